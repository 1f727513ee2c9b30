package io.tsbench.generator.serialize;

import io.tsbench.common.types.Point;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes points in a target's bulk-load format.
 */
public interface PointSerializer {

    void serialize(Point point, Writer out) throws IOException;
}
