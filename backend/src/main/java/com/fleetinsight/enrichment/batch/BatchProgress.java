package com.fleetinsight.enrichment.batch;

/**
 * Progress of one batch run, owned by the caller and handed to {@link BatchDriver}. The driver is the only
 * writer; other threads may read a slightly stale snapshot.
 */
public class BatchProgress {

    private static final BatchProgressListener NO_LISTENER = (batchNumber, totalBatches, recordsDone) -> { };

    private final BatchProgressListener listener;
    private volatile int completedBatches;
    private volatile int totalBatches;
    private volatile int recordsDone;
    private volatile int totalRecords;

    public BatchProgress() {
        this(NO_LISTENER);
    }

    public BatchProgress(BatchProgressListener listener) {
        this.listener = listener != null ? listener : NO_LISTENER;
    }

    void start(int totalBatches, int totalRecords) {
        this.totalBatches = totalBatches;
        this.totalRecords = totalRecords;
        this.completedBatches = 0;
        this.recordsDone = 0;
    }

    void batchCompleted(int batchSize) {
        recordsDone += batchSize;
        completedBatches++;
        listener.onBatchComplete(completedBatches, totalBatches, recordsDone);
    }

    public int getCompletedBatches() {
        return completedBatches;
    }

    public int getTotalBatches() {
        return totalBatches;
    }

    public int getRecordsDone() {
        return recordsDone;
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public boolean isComplete() {
        return completedBatches == totalBatches;
    }
}
