package de.upb.sse.retarget.stats;

import lombok.Data;

@Data
public class CompilationStats {
    private int compiledDeclarations;
    private int skippedDeclarations;
    private int erasedDeclarations;
    private int failedDeclarations;
    private int renamedVariables;
    private int writtenFiles;
    private int deletedFiles;

    public synchronized void incrementCompiledDeclarations() {
        compiledDeclarations++;
    }

    public synchronized void incrementSkippedDeclarations() {
        skippedDeclarations++;
    }

    public synchronized void incrementErasedDeclarations() {
        erasedDeclarations++;
    }

    public synchronized void incrementFailedDeclarations() {
        failedDeclarations++;
    }

    public synchronized void addRenamedVariables(int amount) {
        renamedVariables += amount;
    }

    public void addWrittenFiles(int amount) {
        writtenFiles += amount;
    }

    public void addDeletedFiles(int amount) {
        deletedFiles += amount;
    }

    public int totalConsideredDeclarations() {
        return compiledDeclarations + skippedDeclarations + erasedDeclarations + failedDeclarations;
    }

    // reset between passes to avoid accumulation
    public synchronized void reset() {
        compiledDeclarations = skippedDeclarations = erasedDeclarations = failedDeclarations = 0;
        renamedVariables = writtenFiles = deletedFiles = 0;
    }
}
