package org.fmverify.support;

/**
 * Risultato di un'elaborazione batch: file trovati, riusciti e falliti.
 */
public class BatchOutcome {

    private final int totalFiles;
    private int successCount = 0;
    private int errorCount = 0;

    public BatchOutcome(int totalFiles) {
        this.totalFiles = totalFiles;
    }

    public void incrementSuccess() { successCount++; }
    public void incrementError() { errorCount++; }

    public int getTotalFiles() {
        return totalFiles;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }

    /**
     * @return percentuale di successo, 0 se il batch è vuoto
     */
    public double successRate() {
        return totalFiles == 0 ? 0.0 : (double) successCount / totalFiles * 100;
    }
}
