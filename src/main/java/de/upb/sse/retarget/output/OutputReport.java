package de.upb.sse.retarget.output;

import lombok.Getter;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** What one output pass did on disk and what went wrong. */
@Getter
public class OutputReport {
    @Value
    public static class Failure {
        String path;
        String message;
    }

    private final Path outputDirectory;
    private final List<String> written = new ArrayList<>();
    private final List<String> deleted = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();
    private boolean manifestUpdated;

    public OutputReport(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    /** Report of the manual strategy, which leaves the file system alone. */
    public static OutputReport manual() {
        return new OutputReport(null);
    }

    void addWritten(String path) {
        written.add(path);
    }

    void addDeleted(String path) {
        deleted.add(path);
    }

    void addFailure(String path, String message) {
        failures.add(new Failure(path, message));
    }

    void markManifestUpdated() {
        manifestUpdated = true;
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public List<String> getWritten() {
        return Collections.unmodifiableList(written);
    }

    public List<String> getDeleted() {
        return Collections.unmodifiableList(deleted);
    }

    public List<Failure> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}
