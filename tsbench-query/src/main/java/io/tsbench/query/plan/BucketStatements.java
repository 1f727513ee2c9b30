package io.tsbench.query.plan;

import io.tsbench.query.time.Bucket;

import java.util.List;

public record BucketStatements(Bucket bucket, List<PhysicalStatement> statements) {

    public BucketStatements {
        statements = List.copyOf(statements);
    }
}
