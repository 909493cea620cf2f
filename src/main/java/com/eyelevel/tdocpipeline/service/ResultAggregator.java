package com.eyelevel.tdocpipeline.service;

import com.eyelevel.tdocpipeline.model.PipelineStage;
import com.eyelevel.tdocpipeline.model.StageItem;
import com.eyelevel.tdocpipeline.model.StageOutcome;
import com.eyelevel.tdocpipeline.model.StageSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tallies the outcomes of a stage and keeps the failures, in input order, for reporting.
 */
@Slf4j
@Component
public class ResultAggregator {

    public <T extends StageItem> StageSummary summarize(PipelineStage stage, List<StageOutcome<T>> outcomes) {
        int succeeded = 0;
        int skipped = 0;
        List<StageSummary.FailureDetail> failures = new ArrayList<>();

        for (StageOutcome<T> outcome : outcomes) {
            switch (outcome.status()) {
                case SUCCESS -> succeeded++;
                case SKIPPED -> skipped++;
                case FAILED -> failures.add(new StageSummary.FailureDetail(
                        outcome.item().itemKey(), outcome.result().getMessage()));
            }
        }

        StageSummary summary = new StageSummary(stage, outcomes.size(), succeeded, skipped, failures.size(), failures);
        log.info("[{}] Stage finished. Total: {}, succeeded: {}, skipped: {}, failed: {}",
                stage.getLabel(), summary.total(), succeeded, skipped, failures.size());
        failures.forEach(failure -> log.warn("[{}]   failed: {} - {}", stage.getLabel(), failure.itemKey(), failure.error()));
        return summary;
    }
}
