package com.eyelevel.tdocpipeline.model;

/**
 * Defines the possible outcomes of a single item within a pipeline stage.
 */
public enum StageStatus {
    /**
     * The item was processed and its output now exists on disk.
     */
    SUCCESS,
    /**
     * The item's output already existed on disk and was left untouched.
     */
    SKIPPED,
    /**
     * Processing failed. No output exists, so the next run retries the item.
     */
    FAILED
}
