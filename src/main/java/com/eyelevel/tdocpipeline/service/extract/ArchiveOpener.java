package com.eyelevel.tdocpipeline.service.extract;

import com.eyelevel.tdocpipeline.exception.ArchiveException;
import com.eyelevel.tdocpipeline.model.ExtractedFileItem;

import java.nio.file.Path;
import java.util.List;

/**
 * Opens a local archive and unpacks its entries.
 */
public interface ArchiveOpener {

    /**
     * Streams every extractable entry of the archive into {@code targetDirectory}, keeping the
     * archive's relative structure. Entry content is never held in memory as a whole.
     *
     * @param archive         the archive file
     * @param targetDirectory an existing, empty directory that receives the entries
     * @return the written entries, never empty
     * @throws ArchiveException if the file is not a valid archive or holds nothing to extract;
     *                          entries written before the failure are left for the caller to remove
     */
    List<ExtractedFileItem> open(Path archive, Path targetDirectory);
}
