package de.upb.sse.retarget.configuration;

import lombok.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ToString
@NoArgsConstructor
public class RetargetConfiguration {
    public enum OutputStrategy { MANUAL, SINGLE_FILE, FILE_PER_MODULE, FILE_PER_CLASS }
    public enum DceMode { NONE, SMART }

    private OutputStrategy outputStrategy = OutputStrategy.FILE_PER_CLASS;
    private String fileSuffix = ".out";
    private Path outputDirectory = null;
    // consulted when no output directory was set explicitly
    private String outputDirectoryProperty = "retarget.output";
    private String singleFileName = "main";

    private List<String> ignoredTypes = new ArrayList<>();
    private List<String> reservedVariableNames = new ArrayList<>();
    private String targetCodeInjectionName = null;

    private boolean enforceNullSafety = false;
    private boolean unwrapTypedefs = true;
    private boolean normalizeExpressions = true;
    private DceMode dceMode = DceMode.NONE;
    private boolean deleteOldOutput = true;
    private boolean failOnMissingBody = false;
    private boolean ignoreExterns = true;
    private boolean ignoreNonPhysicalFields = true;
    private boolean parallelCompilation = false;

    public RetargetConfiguration(OutputStrategy outputStrategy, Path outputDirectory, String fileSuffix) {
        this.outputStrategy = outputStrategy;
        this.outputDirectory = outputDirectory;
        this.fileSuffix = fileSuffix;
    }

    /** The configured directory, else the one named by {@link #outputDirectoryProperty}, else null. */
    public Path resolveOutputDirectory() {
        if (outputDirectory != null) return outputDirectory;
        if (outputDirectoryProperty == null) return null;
        String fromProperty = System.getProperty(outputDirectoryProperty, "");
        return fromProperty.isBlank() ? null : Paths.get(fromProperty);
    }

    public boolean isTargetCodeInjectionEnabled() {
        return targetCodeInjectionName != null && !targetCodeInjectionName.isEmpty();
    }
}
