package com.eyelevel.tdocpipeline.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

/**
 * One archive entry after it has been written to disk.
 */
@Getter
@AllArgsConstructor
public class ExtractedFileItem {
    /**
     * Forward-slash separated path of the entry relative to the archive root.
     */
    private final String relativePath;
    private final Path location;
    private final long size;
}
