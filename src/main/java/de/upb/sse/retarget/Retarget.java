package de.upb.sse.retarget;

import de.upb.sse.retarget.api.PublicApi;
import de.upb.sse.retarget.compiler.CompilerDriver;
import de.upb.sse.retarget.compiler.TargetHooks;
import de.upb.sse.retarget.configuration.RetargetConfiguration;
import de.upb.sse.retarget.exceptions.CompilationError;
import de.upb.sse.retarget.exceptions.ConfigurationException;
import de.upb.sse.retarget.ir.Declaration;
import de.upb.sse.retarget.output.OutputFileSystem;
import de.upb.sse.retarget.output.OutputManager;
import de.upb.sse.retarget.output.OutputReport;
import de.upb.sse.retarget.stats.CompilationStats;
import lombok.Getter;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs complete passes: compile every declaration through the target hooks, then realize
 * the result on disk. Passes on one instance run one after another.
 */
public class Retarget {
    private static final Logger logger = Logger.getLogger(Retarget.class.getName());

    @Getter private final RetargetConfiguration config;
    @Getter private final CompilationStats stats = new CompilationStats();
    @Getter private final CompilerDriver driver;
    private final OutputManager outputManager;

    public Retarget(TargetHooks hooks) {
        this(new RetargetConfiguration(), hooks);
    }

    public Retarget(RetargetConfiguration config, TargetHooks hooks) {
        this.config = config;
        this.driver = new CompilerDriver(config, hooks, stats);
        this.outputManager = new OutputManager(config);
    }

    public Retarget(RetargetConfiguration config, TargetHooks hooks, OutputFileSystem fileSystem) {
        this.config = config;
        this.driver = new CompilerDriver(config, hooks, stats);
        this.outputManager = new OutputManager(config, fileSystem);
    }

    public synchronized PublicApi.Result run(List<Declaration> declarations) {
        long start = System.currentTimeMillis();
        stats.reset();

        driver.compile(declarations);
        List<String> failed = driver.getFailedDeclarations();

        OutputReport report;
        try {
            report = outputManager.generate(driver);
        } catch (ConfigurationException e) {
            logger.severe(e.getMessage());
            return new PublicApi.Result(PublicApi.Status.INVALID_CONFIGURATION, null, List.of(), List.of(),
                    failed, System.currentTimeMillis() - start, e.getMessage());
        }
        stats.addWrittenFiles(report.getWritten().size());
        stats.addDeletedFiles(report.getDeleted().size());

        PublicApi.Status status;
        String notes;
        if (!report.isSuccess()) {
            status = PublicApi.Status.FAILED_OUTPUT;
            notes = report.getFailures().stream()
                    .map(f -> f.getPath() + ": " + f.getMessage())
                    .collect(Collectors.joining("; "));
        } else if (!failed.isEmpty()) {
            status = PublicApi.Status.FAILED_DECLARATIONS;
            notes = driver.getErrors().stream()
                    .map(CompilationError::getMessage)
                    .collect(Collectors.joining("; "));
        } else {
            status = PublicApi.Status.OK;
            notes = null;
        }

        long elapsed = System.currentTimeMillis() - start;
        logger.info("Pass finished with " + status + " in " + elapsed + " ms: " + stats);
        return new PublicApi.Result(status, report.getOutputDirectory(), report.getWritten(), report.getDeleted(),
                failed, elapsed, notes);
    }
}
