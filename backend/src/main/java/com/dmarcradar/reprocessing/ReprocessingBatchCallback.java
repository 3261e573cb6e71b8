package com.dmarcradar.reprocessing;

@FunctionalInterface
public interface ReprocessingBatchCallback {
    void onBatch(long processed, long forwarded, long notForwarded, long unknown);
}
