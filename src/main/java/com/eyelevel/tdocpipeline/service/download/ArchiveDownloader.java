package com.eyelevel.tdocpipeline.service.download;

import com.eyelevel.tdocpipeline.exception.TransportException;

import java.net.URI;
import java.nio.file.Path;

/**
 * Transfers one remote archive to a local file.
 */
public interface ArchiveDownloader {

    /**
     * Streams the bytes at {@code source} into {@code target}, replacing any existing content.
     * Every wait is bounded; a stalled transfer fails instead of hanging.
     *
     * @return number of bytes written
     * @throws TransportException on timeouts, connection failures and non-successful responses
     */
    long download(URI source, Path target);
}
