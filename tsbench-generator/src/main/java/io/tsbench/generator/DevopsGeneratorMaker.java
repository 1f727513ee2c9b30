package io.tsbench.generator;

import java.time.Instant;
import java.util.Random;

public interface DevopsGeneratorMaker extends GeneratorFactory {

    UseCaseGenerator newDevops(Instant start, Instant end, int scale, Random random);
}
