package com.eyelevel.tdocpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a document fails to be rendered into its HTML and Markdown representations.
 * The message carries the reason reported by the rendering engine.
 */
public class ConversionException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
