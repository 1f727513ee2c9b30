package io.tsbench.query;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON lines encoding of high-level queries and plans: one document per line, ISO-8601
 * instants and durations.
 */
public final class QueryCodec {

    private static final ObjectMapper MAPPER = createMapper();

    private QueryCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static void write(Writer writer, Object value) throws IOException {
        writer.write(MAPPER.writeValueAsString(value));
        writer.write('\n');
    }

    public static HighLevelQuery parse(String line) throws IOException {
        return MAPPER.readValue(line, HighLevelQuery.class);
    }

    public static List<HighLevelQuery> readAll(BufferedReader reader) throws IOException {
        var result = new ArrayList<HighLevelQuery>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) {
                result.add(parse(line));
            }
        }
        return result;
    }
}
