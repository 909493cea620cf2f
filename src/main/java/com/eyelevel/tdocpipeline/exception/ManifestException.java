package com.eyelevel.tdocpipeline.exception;

import java.io.Serial;

/**
 * Thrown when the remote manifest is unreachable or cannot be parsed into identifiers.
 */
public class ManifestException extends FatalSetupException {
    @Serial
    private static final long serialVersionUID = -6120953394427196178L;

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
