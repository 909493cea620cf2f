package com.eyelevel.tdocpipeline.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * The outcome returned by every worker of every stage: success with a detail,
 * skip with a reason, or failure with an error message.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StageResult {

    private final StageStatus status;
    private final String message;

    public static StageResult success(String detail) {
        return new StageResult(StageStatus.SUCCESS, detail);
    }

    public static StageResult skipped(String reason) {
        return new StageResult(StageStatus.SKIPPED, reason);
    }

    public static StageResult failed(String error) {
        return new StageResult(StageStatus.FAILED, error);
    }

    public boolean isFailed() {
        return status == StageStatus.FAILED;
    }
}
