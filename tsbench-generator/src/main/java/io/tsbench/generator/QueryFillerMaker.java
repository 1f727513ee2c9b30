package io.tsbench.generator;

import io.tsbench.common.BenchmarkException;

/**
 * Binds one query type to a backend generator.
 */
@FunctionalInterface
public interface QueryFillerMaker {

    /**
     * @throws BenchmarkException UNSUPPORTED_USE_CASE if the generator cannot produce this query type
     */
    QueryFiller make(UseCaseGenerator generator);

    /**
     * The generator as {@code capability}, or a typed error naming the query type.
     */
    static <T> T require(UseCaseGenerator generator, Class<T> capability, String queryType) {
        if (!capability.isInstance(generator)) {
            throw BenchmarkException.unsupported("%s does not implement %s, needed for query type '%s'",
                    generator.getClass().getSimpleName(), capability.getSimpleName(), queryType);
        }
        return capability.cast(generator);
    }
}
