package dev.devanks.voltedge.pipeline.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Where to read from and whether a table that fails validation may still be featurized.
 */
@Value
@Builder
public class PipelineRequest {
    @NonNull
    Path archivePath;
    String expectedSha256;
    boolean allowInvalid;
}
