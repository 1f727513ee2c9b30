package io.tsbench.generator;

import io.tsbench.common.BenchmarkException;
import io.tsbench.generator.cassandra.CassandraGeneratorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static io.tsbench.common.ConfigConstants.*;

/**
 * Backend factories by format. Capabilities are worked out once at registration, so an
 * unsupported (format, use case) pair is rejected before any generator is built.
 */
public final class QueryGeneratorFactories {

    private static final Logger log = LoggerFactory.getLogger(QueryGeneratorFactories.class);

    public enum Capability {
        DEVOPS,
        IOT
    }

    private record Registration(GeneratorFactory factory, Set<Capability> capabilities) {
    }

    private final Map<String, Registration> factories;

    private QueryGeneratorFactories(Map<String, Registration> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static QueryGeneratorFactories defaults() {
        return builder()
                .register(FORMAT_CASSANDRA, new CassandraGeneratorFactory())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> formats() {
        return factories.keySet();
    }

    public Set<Capability> capabilities(String format) {
        return registration(format).capabilities();
    }

    public boolean supports(String format, String useCase) {
        var registration = factories.get(format);
        return registration != null && registration.capabilities().contains(capabilityFor(useCase));
    }

    /**
     * @throws BenchmarkException UNSUPPORTED_USE_CASE for an unknown format or use case, or a
     *                            backend without the use case's capability
     */
    public UseCaseGenerator generatorFor(String format, String useCase, Instant start, Instant end, int scale,
                                         Random random) {
        var registration = registration(format);
        var capability = capabilityFor(useCase);
        if (!registration.capabilities().contains(capability)) {
            throw BenchmarkException.unsupported("use case '%s' not implemented for format '%s'", useCase, format);
        }
        switch (capability) {
            case DEVOPS:
                return ((DevopsGeneratorMaker) registration.factory()).newDevops(start, end, scale, random);
            case IOT:
                return ((IoTGeneratorMaker) registration.factory()).newIoT(start, end, scale, random);
            default:
                throw new IllegalStateException("unhandled capability " + capability);
        }
    }

    private Registration registration(String format) {
        var registration = factories.get(format);
        if (registration == null) {
            throw BenchmarkException.unsupported("unknown format '%s', known formats are %s", format, factories.keySet());
        }
        return registration;
    }

    static Capability capabilityFor(String useCase) {
        switch (useCase) {
            case USE_CASE_DEVOPS:
            case USE_CASE_CPU_ONLY:
                return Capability.DEVOPS;
            case USE_CASE_IOT:
                return Capability.IOT;
            default:
                throw BenchmarkException.unsupported("use case '%s' is undefined", useCase);
        }
    }

    public static class Builder {
        private final Map<String, Registration> factories = new LinkedHashMap<>();

        /**
         * @throws BenchmarkException UNSUPPORTED_USE_CASE if the factory supports no use case
         */
        public Builder register(String format, GeneratorFactory factory) {
            var capabilities = EnumSet.noneOf(Capability.class);
            if (factory instanceof DevopsGeneratorMaker) {
                capabilities.add(Capability.DEVOPS);
            }
            if (factory instanceof IoTGeneratorMaker) {
                capabilities.add(Capability.IOT);
            }
            if (capabilities.isEmpty()) {
                throw BenchmarkException.unsupported("query generator factory for format '%s' implements no use case",
                        format);
            }
            factories.put(format, new Registration(factory, Collections.unmodifiableSet(capabilities)));
            log.debug("registered format {} with {}", format, capabilities);
            return this;
        }

        public QueryGeneratorFactories build() {
            return new QueryGeneratorFactories(factories);
        }
    }
}
