package com.eyelevel.tdocpipeline.model;

import java.nio.file.Path;

/**
 * One downloaded archive to be unpacked into its own content directory.
 *
 * @param artifactId           the identifier of the archive
 * @param archivePath          the local archive file
 * @param destinationDirectory the directory that holds the archive contents once extracted
 */
public record ExtractionRecord(String artifactId, Path archivePath, Path destinationDirectory) implements StageItem {

    @Override
    public String itemKey() {
        return artifactId;
    }
}
