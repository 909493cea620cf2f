package com.eyelevel.tdocpipeline.service.extract;

import com.eyelevel.tdocpipeline.exception.ArchiveException;
import com.eyelevel.tdocpipeline.model.ExtractedFileItem;
import com.eyelevel.tdocpipeline.model.ExtractionRecord;
import com.eyelevel.tdocpipeline.model.StageResult;
import com.eyelevel.tdocpipeline.service.StageWorker;
import com.eyelevel.tdocpipeline.skip.ExtractionSkipPredicate;
import com.eyelevel.tdocpipeline.skip.SkipDecision;
import com.eyelevel.tdocpipeline.storage.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Extraction stage worker. Entries are streamed into a staging directory and the staging
 * directory is moved onto the destination in one step, so the destination is never touched
 * before the whole archive has been read. A failed extraction leaves no destination directory behind.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractionWorker implements StageWorker<ExtractionRecord> {

    private final ExtractionSkipPredicate skipPredicate;
    private final ArchiveOpener archiveOpener;
    private final ArtifactStore artifactStore;

    @Override
    public StageResult process(ExtractionRecord item) {
        SkipDecision decision = skipPredicate.evaluate(item);
        if (decision.skip()) {
            return StageResult.skipped(decision.reason());
        }
        if (!Files.isRegularFile(item.archivePath())) {
            return StageResult.failed("Archive not downloaded: " + item.archivePath().getFileName());
        }

        final Path destination = item.destinationDirectory();
        final Path staging = artifactStore.extractionStagingDirectory(item.artifactId());
        try {
            prepareStaging(staging);
            List<ExtractedFileItem> entries = archiveOpener.open(item.archivePath(), staging);
            replaceDestination(staging, destination);
            log.debug("[{}] Extracted {} entries into {}", item.artifactId(), entries.size(), destination);
            return StageResult.success(entries.size() + " entries extracted");
        } catch (ArchiveException e) {
            cleanup(item, e, staging, destination);
            log.warn("[{}] Archive {} rejected: {}", item.artifactId(), item.archivePath().getFileName(), e.getMessage());
            return StageResult.failed(e.getMessage());
        } catch (IOException | RuntimeException e) {
            cleanup(item, e, staging, destination);
            log.error("[{}] Failed to write extracted entries.", item.artifactId(), e);
            return StageResult.failed("Failed to write extracted entries: " + e.getMessage());
        }
    }

    /**
     * Starts every attempt from an empty staging directory, whatever an interrupted run left there.
     */
    private void prepareStaging(Path staging) throws IOException {
        FileUtils.deleteDirectory(staging.toFile());
        Files.createDirectories(staging);
    }

    /**
     * Moves the fully written staging directory onto the destination. An empty destination left
     * by an earlier failed attempt is removed first.
     */
    private void replaceDestination(Path staging, Path destination) throws IOException {
        FileUtils.deleteDirectory(destination.toFile());
        Files.createDirectories(destination.getParent());
        try {
            Files.move(staging, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staging, destination);
        }
    }

    private void cleanup(ExtractionRecord item, Exception originalException, Path... directories) {
        for (Path directory : directories) {
            try {
                FileUtils.deleteDirectory(directory.toFile());
            } catch (IOException cleanupEx) {
                log.error("[{}] CRITICAL: Failed to remove {} after a failed extraction.",
                        item.artifactId(), directory, cleanupEx);
                originalException.addSuppressed(cleanupEx);
            }
        }
    }
}
