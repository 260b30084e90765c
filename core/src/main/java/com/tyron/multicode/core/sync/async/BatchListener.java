package com.tyron.multicode.core.sync.async;

/**
 * Notified on the sync thread after each batch. Implementations should return quickly.
 */
@FunctionalInterface
public interface BatchListener {

    void batchApplied(AppliedBatch batch);
}
