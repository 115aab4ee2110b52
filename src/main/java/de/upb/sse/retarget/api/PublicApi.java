package de.upb.sse.retarget.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public final class PublicApi {

    public enum Status {
        OK,
        /** At least one declaration hit a fatal emission failure; the others were still produced. */
        FAILED_DECLARATIONS,
        /** Writing, deleting or the manifest failed; the manifest was left as it was. */
        FAILED_OUTPUT,
        /** Output was requested without a destination. */
        INVALID_CONFIGURATION
    }

    public static final class Result {
        public final Status status;

        /** Null for the manual strategy or when no directory could be resolved. */
        public final Path outputDirectory;

        /** Relative paths written in this pass, in write order. */
        public final List<String> writtenFiles;

        /** Relative paths removed because the previous pass produced them and this one did not. */
        public final List<String> deletedFiles;

        /** Type paths of declarations that failed to compile. */
        public final List<String> failedDeclarations;

        /** Elapsed time in ms. */
        public final long elapsedMs;

        /** Human-readable detail for failures. */
        public final String notes;

        public Result(Status status,
                      Path outputDirectory,
                      List<String> writtenFiles,
                      List<String> deletedFiles,
                      List<String> failedDeclarations,
                      long elapsedMs,
                      String notes) {
            this.status = Objects.requireNonNull(status, "status");
            this.outputDirectory = outputDirectory;
            this.writtenFiles = List.copyOf(Objects.requireNonNull(writtenFiles, "writtenFiles"));
            this.deletedFiles = List.copyOf(Objects.requireNonNull(deletedFiles, "deletedFiles"));
            this.failedDeclarations = List.copyOf(Objects.requireNonNull(failedDeclarations, "failedDeclarations"));
            this.elapsedMs = elapsedMs;
            this.notes = notes == null ? "" : notes;
        }

        public boolean isOk() {
            return status == Status.OK;
        }
    }
}
