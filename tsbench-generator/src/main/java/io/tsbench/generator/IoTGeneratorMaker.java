package io.tsbench.generator;

import java.time.Instant;
import java.util.Random;

public interface IoTGeneratorMaker extends GeneratorFactory {

    UseCaseGenerator newIoT(Instant start, Instant end, int scale, Random random);
}
