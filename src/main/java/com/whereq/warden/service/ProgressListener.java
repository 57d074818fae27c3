package com.whereq.warden.service;

/**
 * Callback invoked once per job of a batch, before the job runs
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param current 1-based position of the job
     * @param total   number of jobs in the batch
     * @param jobId   id of the job about to run
     */
    void onProgress(int current, int total, String jobId);
}
