package com.eyelevel.tdocpipeline.service.manifest;

import com.eyelevel.tdocpipeline.exception.ManifestException;

import java.net.URI;
import java.util.List;

/**
 * Produces the ordered list of artifact identifiers published by a remote source.
 */
public interface ManifestFetcher {

    /**
     * Fetches the manifest.
     *
     * @param source location of the manifest
     * @return identifiers in manifest order, without duplicates; possibly empty
     * @throws ManifestException if the source is unreachable or its content cannot be parsed
     */
    List<String> fetch(URI source);
}
