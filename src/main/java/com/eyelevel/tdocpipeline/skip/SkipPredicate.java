package com.eyelevel.tdocpipeline.skip;

/**
 * Decides, from durable storage alone, whether a stage item is already done.
 * Each stage has exactly one implementation; no other code decides what "done" means.
 *
 * @param <T> the stage's work item type
 */
@FunctionalInterface
public interface SkipPredicate<T> {

    SkipDecision evaluate(T item);
}
