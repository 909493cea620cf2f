package com.eyelevel.tdocpipeline.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The three phases of a pipeline run, in execution order.
 */
@Getter
@RequiredArgsConstructor
public enum PipelineStage {
    DOWNLOAD("download"),
    EXTRACT("extract"),
    CONVERT("convert");

    private final String label;
}
