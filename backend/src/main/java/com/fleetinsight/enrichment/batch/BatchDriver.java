package com.fleetinsight.enrichment.batch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Splits a record list into contiguous batches of {@code batchSize} (the last may be shorter), runs the
 * enrichment function on each batch in order, and concatenates the results. Batches run strictly one
 * after another; progress is reported after every batch.
 */
@Component
@Slf4j
public class BatchDriver {

    public <R, E> List<E> run(String label, List<R> records, int batchSize,
                              Function<List<R>, List<E>> enrichBatch, BatchProgress progress) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        int totalBatches = totalBatches(records.size(), batchSize);
        progress.start(totalBatches, records.size());
        List<E> out = new ArrayList<>(records.size());
        for (int batch = 0; batch < totalBatches; batch++) {
            int from = batch * batchSize;
            int to = Math.min(from + batchSize, records.size());
            List<R> slice = records.subList(from, to);
            List<E> enriched = enrichBatch.apply(slice);
            if (enriched.size() != slice.size()) {
                throw new IllegalStateException("Batch " + (batch + 1) + " of " + label + " returned "
                        + enriched.size() + " records for " + slice.size() + " inputs");
            }
            out.addAll(enriched);
            progress.batchCompleted(slice.size());
            log.info("Processed {} batch {}/{}", label, batch + 1, totalBatches);
        }
        return out;
    }

    static int totalBatches(int recordCount, int batchSize) {
        return (recordCount + batchSize - 1) / batchSize;
    }
}
