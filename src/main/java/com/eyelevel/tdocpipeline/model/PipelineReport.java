package com.eyelevel.tdocpipeline.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Final result of a completed run, used for the closing summary.
 */
@Getter
@Builder
@ToString
public class PipelineReport {
    private final PipelineState state;
    private final int manifestSize;
    private final int documentCount;
    private final StageSummary download;
    private final StageSummary extract;
    private final StageSummary convert;
    private final Path downloadDirectory;
    private final Path extractDirectory;
    private final Path richLayoutDirectory;
    private final Path structuredTextDirectory;
}
