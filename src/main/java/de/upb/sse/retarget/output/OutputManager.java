package de.upb.sse.retarget.output;

import de.upb.sse.retarget.compiler.CompiledDeclaration;
import de.upb.sse.retarget.compiler.CompilerDriver;
import de.upb.sse.retarget.configuration.RetargetConfiguration;
import de.upb.sse.retarget.configuration.RetargetConfiguration.OutputStrategy;
import de.upb.sse.retarget.exceptions.ConfigurationException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Turns the accumulated declaration texts into files according to the configured
 * {@link OutputStrategy} and removes files a previous pass produced but this one did not.
 *
 * The paths of every pass are kept in {@value #MANIFEST_FILE} inside the output directory.
 * The manifest only moves forward when the whole pass succeeded; after a failed pass it
 * also lists the files that pass wrote, so the next successful one cleans them up.
 */
public class OutputManager {
    public static final String MANIFEST_FILE = "_GeneratedFiles.txt";
    private static final Logger logger = Logger.getLogger(OutputManager.class.getName());

    private final RetargetConfiguration config;
    private final OutputFileSystem fileSystem;

    public OutputManager(RetargetConfiguration config) {
        this(config, new NioOutputFileSystem());
    }

    public OutputManager(RetargetConfiguration config, OutputFileSystem fileSystem) {
        this.config = Objects.requireNonNull(config, "config");
        this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
    }

    public OutputReport generate(CompilerDriver driver) {
        return generate(driver.getCompiledDeclarations(), driver.getExtraFiles());
    }

    public OutputReport generate(List<CompiledDeclaration> compiled, Map<String, String> extraFiles) {
        OutputStrategy strategy = config.getOutputStrategy();
        if (strategy == OutputStrategy.MANUAL) {
            logger.fine("Manual output strategy, nothing written");
            return OutputReport.manual();
        }

        Path outputDir = config.resolveOutputDirectory();
        if (outputDir == null) {
            throw new ConfigurationException("No output directory configured: set outputDirectory or the system property '"
                    + config.getOutputDirectoryProperty() + "'");
        }
        outputDir = outputDir.toAbsolutePath().normalize();

        List<OutputArtifact> artifacts = plan(compiled, extraFiles);
        OutputReport report = new OutputReport(outputDir);
        Path manifest = outputDir.resolve(MANIFEST_FILE);

        List<String> previous = readManifest(outputDir, manifest, report);
        boolean manifestReadable = previous != null;
        if (previous == null) previous = List.of();

        Set<String> current = new LinkedHashSet<>();
        for (OutputArtifact artifact : artifacts) {
            Path target = resolveInside(outputDir, artifact.getRelativePath(), report);
            if (target == null) continue;
            if (target.equals(manifest)) {
                logger.warning("Refusing to write " + artifact.getRelativePath() + ", the name is reserved for the manifest");
                report.addFailure(artifact.getRelativePath(), "path is reserved for the manifest");
                continue;
            }
            current.add(artifact.getRelativePath());
            try {
                fileSystem.write(target, artifact.getContent());
                report.addWritten(artifact.getRelativePath());
            } catch (IOException e) {
                logger.warning("Could not write " + target + ": " + e.getMessage());
                report.addFailure(artifact.getRelativePath(), "write failed: " + e.getMessage());
            }
        }

        boolean cleanup = config.isDeleteOldOutput() && strategy != OutputStrategy.SINGLE_FILE;
        if (report.isSuccess() && cleanup) {
            for (String old : previous) {
                if (current.contains(old)) continue;
                try {
                    fileSystem.delete(outputDir.resolve(old).normalize());
                    report.addDeleted(old);
                } catch (IOException e) {
                    logger.warning("Could not delete stale output " + old + ": " + e.getMessage());
                    report.addFailure(old, "delete failed: " + e.getMessage());
                }
            }
        }

        if (manifestReadable) {
            writeManifest(manifest, report, previous, current);
        } else {
            logger.warning("Manifest " + manifest + " could not be read and is left unchanged");
        }

        logger.info("Wrote " + report.getWritten().size() + " files to " + outputDir
                + ", deleted " + report.getDeleted().size() + " stale files");
        return report;
    }

    /**
     * A successful pass records exactly what it produced. A failed pass keeps every entry
     * of the previous manifest that still exists and adds what it managed to write, so the
     * next successful pass can still remove all of it.
     */
    private void writeManifest(Path manifest, OutputReport report, List<String> previous, Set<String> current) {
        boolean advance = report.isSuccess();
        Set<String> entries = new LinkedHashSet<>();
        if (advance) {
            entries.addAll(current);
        } else {
            entries.addAll(previous);
            entries.removeAll(report.getDeleted());
            entries.addAll(report.getWritten());
            logger.warning("Output pass failed, manifest " + manifest + " keeps the entries of the previous pass");
        }
        try {
            fileSystem.write(manifest, String.join("\n", entries) + (entries.isEmpty() ? "" : "\n"));
            if (advance) report.markManifestUpdated();
        } catch (IOException e) {
            logger.warning("Could not write manifest " + manifest + ": " + e.getMessage());
            report.addFailure(MANIFEST_FILE, "manifest write failed: " + e.getMessage());
        }
    }

    /**
     * Groups the compiled texts into artifacts for the configured strategy, in declaration
     * order. Extra files follow; text for an already planned path is appended to it.
     */
    public List<OutputArtifact> plan(List<CompiledDeclaration> compiled, Map<String, String> extraFiles) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        switch (config.getOutputStrategy()) {
            case MANUAL:
                return List.of();
            case SINGLE_FILE:
                // the single file exists even when nothing was compiled
                List<String> texts = grouped.computeIfAbsent(config.getSingleFileName() + config.getFileSuffix(), k -> new ArrayList<>());
                for (CompiledDeclaration c : compiled) {
                    texts.add(c.getText());
                }
                break;
            case FILE_PER_MODULE:
                for (CompiledDeclaration c : compiled) {
                    grouped.computeIfAbsent(toRelativePath(c.getDeclaration().getModule()), k -> new ArrayList<>()).add(c.getText());
                }
                break;
            case FILE_PER_CLASS:
                for (CompiledDeclaration c : compiled) {
                    grouped.computeIfAbsent(toRelativePath(c.getDeclaration().getTypePath()), k -> new ArrayList<>()).add(c.getText());
                }
                break;
        }
        extraFiles.forEach((path, text) -> grouped.computeIfAbsent(path, k -> new ArrayList<>()).add(text));

        List<OutputArtifact> artifacts = new ArrayList<>();
        grouped.forEach((path, texts) -> artifacts.add(new OutputArtifact(path, join(texts))));
        return artifacts;
    }

    private String toRelativePath(String dottedPath) {
        return dottedPath.replace('.', '/') + config.getFileSuffix();
    }

    private static String join(List<String> texts) {
        if (texts.isEmpty()) return "";
        String joined = String.join("\n\n", texts);
        return joined.endsWith("\n") ? joined : joined + "\n";
    }

    /** Entries of the previous pass, or null when the manifest exists but cannot be read. */
    private List<String> readManifest(Path outputDir, Path manifest, OutputReport report) {
        if (!fileSystem.exists(manifest)) return List.of();
        List<String> lines;
        try {
            lines = fileSystem.readLines(manifest);
        } catch (IOException e) {
            logger.warning("Could not read manifest " + manifest + ": " + e.getMessage());
            report.addFailure(MANIFEST_FILE, "manifest read failed: " + e.getMessage());
            return null;
        }
        List<String> paths = new ArrayList<>();
        for (String line : lines) {
            String path = line.trim();
            if (path.isEmpty()) continue;
            Path resolved = outputDir.resolve(path).normalize();
            if (!resolved.startsWith(outputDir) || resolved.equals(outputDir) || resolved.equals(manifest)) {
                // dropped here, so the next manifest no longer carries it
                logger.warning("Ignoring manifest entry " + path + ", it does not name a file inside " + outputDir);
                continue;
            }
            paths.add(path);
        }
        return paths;
    }

    private Path resolveInside(Path outputDir, String relativePath, OutputReport report) {
        Path target = outputDir.resolve(relativePath).normalize();
        if (!target.startsWith(outputDir) || target.equals(outputDir)) {
            logger.warning("Refusing to touch " + relativePath + ", it is outside " + outputDir);
            report.addFailure(relativePath, "path escapes the output directory");
            return null;
        }
        return target;
    }
}
