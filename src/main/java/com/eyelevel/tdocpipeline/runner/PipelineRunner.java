package com.eyelevel.tdocpipeline.runner;

import com.eyelevel.tdocpipeline.model.PipelineReport;
import com.eyelevel.tdocpipeline.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the pipeline once after the application context has started. A fatal setup error
 * propagates and fails the startup, which ends the process with a non-zero exit code.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.pipeline", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class PipelineRunner implements ApplicationRunner {

    private final PipelineOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Starting TDoc pipeline run.");
        PipelineReport report = orchestrator.run();
        log.info("Pipeline run finished in state {}.", report.getState());
    }
}
