package com.eyelevel.tdocpipeline.service;

import com.eyelevel.tdocpipeline.model.StageItem;
import com.eyelevel.tdocpipeline.model.StageResult;

/**
 * Processes one item of a stage. Implementations convert item-scoped errors into a failed
 * {@link StageResult}; anything that still escapes is caught by the {@link StageExecutor}.
 *
 * @param <T> the stage's work item type
 */
@FunctionalInterface
public interface StageWorker<T extends StageItem> {

    StageResult process(T item);
}
