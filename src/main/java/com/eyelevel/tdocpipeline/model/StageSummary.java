package com.eyelevel.tdocpipeline.model;

import java.util.List;

/**
 * Aggregate result of one stage: counts per status plus every failure, in input order.
 */
public record StageSummary(PipelineStage stage, int total, int succeeded, int skipped, int failed,
                           List<FailureDetail> failures) {

    public StageSummary {
        failures = List.copyOf(failures);
    }

    public static StageSummary empty(PipelineStage stage) {
        return new StageSummary(stage, 0, 0, 0, 0, List.of());
    }

    /**
     * @param itemKey the failed item's key
     * @param error   the error detail reported by the worker
     */
    public record FailureDetail(String itemKey, String error) {
    }
}
