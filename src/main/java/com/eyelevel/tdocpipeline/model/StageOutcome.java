package com.eyelevel.tdocpipeline.model;

/**
 * Pairs a work item with the result its worker produced.
 *
 * @param item   the work item, as submitted to the stage
 * @param result the worker's result for that item
 * @param <T>    the work item type
 */
public record StageOutcome<T extends StageItem>(T item, StageResult result) {

    public StageStatus status() {
        return result.getStatus();
    }

    public boolean isFailed() {
        return result.isFailed();
    }
}
