package io.tsbench.generator;

/**
 * Backend entry point. A backend supports a use case by also implementing
 * {@link DevopsGeneratorMaker} or {@link IoTGeneratorMaker}.
 */
public interface GeneratorFactory {
}
