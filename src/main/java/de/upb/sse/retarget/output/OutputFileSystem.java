package de.upb.sse.retarget.output;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** File primitives used by {@link OutputManager}. */
public interface OutputFileSystem {
    boolean exists(Path file);

    List<String> readLines(Path file) throws IOException;

    /** Writes {@code content}, creating missing parent directories. */
    void write(Path file, String content) throws IOException;

    /** Deletes {@code file} if it exists. */
    void delete(Path file) throws IOException;
}
