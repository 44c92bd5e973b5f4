package com.fleetinsight.enrichment.batch;

@FunctionalInterface
public interface BatchProgressListener {
    void onBatchComplete(int batchNumber, int totalBatches, int recordsDone);
}
