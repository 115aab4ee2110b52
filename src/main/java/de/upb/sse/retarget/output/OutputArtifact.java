package de.upb.sse.retarget.output;

import lombok.NonNull;
import lombok.Value;

/** A file to produce: path relative to the output directory and its full text. */
@Value
public class OutputArtifact {
    @NonNull String relativePath;
    @NonNull String content;
}
