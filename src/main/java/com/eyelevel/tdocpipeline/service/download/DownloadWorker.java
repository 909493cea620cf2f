package com.eyelevel.tdocpipeline.service.download;

import com.eyelevel.tdocpipeline.exception.TransportException;
import com.eyelevel.tdocpipeline.model.DownloadRecord;
import com.eyelevel.tdocpipeline.model.StageResult;
import com.eyelevel.tdocpipeline.service.StageWorker;
import com.eyelevel.tdocpipeline.skip.DownloadSkipPredicate;
import com.eyelevel.tdocpipeline.skip.SkipDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 * Download stage worker. The archive is written to a {@code .part} sibling and only moved onto
 * its final name once the transfer completed, so the skip predicate never sees a truncated file.
 * On failure neither the partial file nor the final file is left behind.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DownloadWorker implements StageWorker<DownloadRecord> {

    static final String PARTIAL_SUFFIX = ".part";

    private final DownloadSkipPredicate skipPredicate;
    private final ArchiveDownloader archiveDownloader;

    @Override
    public StageResult process(DownloadRecord item) {
        SkipDecision decision = skipPredicate.evaluate(item);
        if (decision.skip()) {
            return StageResult.skipped(decision.reason());
        }

        final Path target = item.localPath();
        final Path partial = partialPath(target);
        try {
            Files.deleteIfExists(target);
            long bytes = archiveDownloader.download(item.remoteUri(), partial);
            moveIntoPlace(partial, target);
            return StageResult.success(formatSize(bytes));
        } catch (TransportException e) {
            cleanup(item, e, partial, target);
            log.warn("[{}] Download from {} failed: {}", item.artifactId(), item.remoteUri(), e.getMessage());
            return StageResult.failed(e.getMessage());
        } catch (IOException | RuntimeException e) {
            cleanup(item, e, partial, target);
            log.error("[{}] Download into {} failed.", item.artifactId(), target, e);
            return StageResult.failed("Download failed: " + e.getMessage());
        }
    }

    static Path partialPath(Path target) {
        return target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
    }

    private void moveIntoPlace(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void cleanup(DownloadRecord item, Exception originalException, Path... paths) {
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException cleanupEx) {
                log.error("[{}] CRITICAL: Failed to delete partial download: {}", item.artifactId(), path, cleanupEx);
                originalException.addSuppressed(cleanupEx);
            }
        }
    }

    private static String formatSize(long bytes) {
        return String.format(Locale.ROOT, "%d bytes (%.2f MB)", bytes, bytes / (1024.0 * 1024.0));
    }
}
