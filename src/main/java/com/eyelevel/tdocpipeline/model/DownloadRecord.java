package com.eyelevel.tdocpipeline.model;

import java.net.URI;
import java.nio.file.Path;

/**
 * One remote archive to be fetched.
 *
 * @param artifactId    the identifier of the archive within the manifest
 * @param remoteUri     where the archive is downloaded from
 * @param localPath     where the finished download is stored
 */
public record DownloadRecord(String artifactId, URI remoteUri, Path localPath) implements StageItem {

    @Override
    public String itemKey() {
        return artifactId;
    }
}
