package com.eyelevel.tdocpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a remote archive cannot be transferred: connection failures, timeouts and
 * non-successful HTTP responses. Scoped to a single item of the download stage.
 */
public class TransportException extends PipelineException {
    @Serial
    private static final long serialVersionUID = -2630960519312357215L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
