package com.eyelevel.tdocpipeline.exception;

import java.io.Serial;

/**
 * Thrown when a downloaded file is not a usable archive (corrupt, wrong format, no extractable
 * entries or an entry that would escape the destination directory).
 */
public class ArchiveException extends PipelineException {
    @Serial
    private static final long serialVersionUID = -144348853764116326L;

    public ArchiveException(String message) {
        super(message);
    }

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
