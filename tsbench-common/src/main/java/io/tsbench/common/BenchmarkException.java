package io.tsbench.common;

public class BenchmarkException extends RuntimeException {
    final ErrorKind kind;

    public BenchmarkException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BenchmarkException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static BenchmarkException malformed(String format, Object... args) {
        return new BenchmarkException(ErrorKind.MALFORMED_QUERY_SPEC, String.format(format, args));
    }

    public static BenchmarkException inconsistent(String format, Object... args) {
        return new BenchmarkException(ErrorKind.INDEX_INCONSISTENCY, String.format(format, args));
    }

    public static BenchmarkException unsupported(String format, Object... args) {
        return new BenchmarkException(ErrorKind.UNSUPPORTED_USE_CASE, String.format(format, args));
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
