package com.eyelevel.tdocpipeline.skip;

/**
 * Verdict of a {@link SkipPredicate}: skip the item (with a reason) or process it.
 */
public record SkipDecision(boolean skip, String reason) {

    private static final SkipDecision PROCESS = new SkipDecision(false, null);

    public static SkipDecision skip(String reason) {
        return new SkipDecision(true, reason);
    }

    public static SkipDecision process() {
        return PROCESS;
    }
}
