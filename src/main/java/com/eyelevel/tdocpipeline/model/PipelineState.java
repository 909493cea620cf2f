package com.eyelevel.tdocpipeline.model;

/**
 * Lifecycle of a single orchestrator run.
 */
public enum PipelineState {
    IDLE,
    FETCHING,
    DOWNLOAD_STAGE,
    EXTRACT_STAGE,
    CONVERT_STAGE,
    DONE,
    /**
     * Terminal state reached when setup fails; no stage ran to completion afterwards.
     */
    FATAL_ABORT
}
