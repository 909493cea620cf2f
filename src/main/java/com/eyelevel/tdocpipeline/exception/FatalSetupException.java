package com.eyelevel.tdocpipeline.exception;

import java.io.Serial;

/**
 * Aborts a whole run before any stage starts, e.g. when the storage root cannot be prepared
 * or the manifest cannot be obtained. This is the only error that stops processing of other items.
 */
public class FatalSetupException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 8830271546624337109L;

    public FatalSetupException(String message) {
        super(message);
    }

    public FatalSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
