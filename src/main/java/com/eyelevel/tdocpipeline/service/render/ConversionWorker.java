package com.eyelevel.tdocpipeline.service.render;

import com.eyelevel.tdocpipeline.exception.ConversionException;
import com.eyelevel.tdocpipeline.model.ConversionUnit;
import com.eyelevel.tdocpipeline.model.Rendition;
import com.eyelevel.tdocpipeline.model.StageResult;
import com.eyelevel.tdocpipeline.service.StageWorker;
import com.eyelevel.tdocpipeline.skip.ConversionSkipPredicate;
import com.eyelevel.tdocpipeline.skip.SkipDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Conversion stage worker. Both renditions are produced by one engine call and written
 * together: after a failure neither output path exists.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionWorker implements StageWorker<ConversionUnit> {

    static final String TEMP_SUFFIX = ".tmp";

    private final ConversionSkipPredicate skipPredicate;
    private final ConversionEngine conversionEngine;

    @Override
    public StageResult process(ConversionUnit item) {
        SkipDecision decision = skipPredicate.evaluate(item);
        if (decision.skip()) {
            return StageResult.skipped(decision.reason());
        }

        final Path richLayout = item.richLayoutPath();
        final Path structuredText = item.structuredTextPath();
        final Path richLayoutTemp = tempPath(richLayout);
        final Path structuredTextTemp = tempPath(structuredText);
        try {
            Files.deleteIfExists(richLayout);
            Files.deleteIfExists(structuredText);

            Rendition rendition = conversionEngine.render(item.sourceDocument());
            if (rendition == null || !rendition.isComplete()) {
                throw new ConversionException("Conversion produced only a partial rendition");
            }

            Files.createDirectories(richLayout.getParent());
            Files.createDirectories(structuredText.getParent());
            Files.writeString(richLayoutTemp, rendition.richLayout(), StandardCharsets.UTF_8);
            Files.writeString(structuredTextTemp, rendition.structuredText(), StandardCharsets.UTF_8);
            moveIntoPlace(richLayoutTemp, richLayout);
            moveIntoPlace(structuredTextTemp, structuredText);
            return StageResult.success(richLayout.getFileName() + ", " + structuredText.getFileName());
        } catch (ConversionException e) {
            cleanup(item, e, richLayoutTemp, structuredTextTemp, richLayout, structuredText);
            log.warn("[{}] Conversion failed: {}", item.itemKey(), e.getMessage());
            return StageResult.failed(e.getMessage());
        } catch (IOException | RuntimeException e) {
            cleanup(item, e, richLayoutTemp, structuredTextTemp, richLayout, structuredText);
            log.error("[{}] Failed to write renditions.", item.itemKey(), e);
            return StageResult.failed("Conversion failed: " + e.getMessage());
        }
    }

    static Path tempPath(Path target) {
        return target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void cleanup(ConversionUnit item, Exception originalException, Path... files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException cleanupEx) {
                log.error("[{}] CRITICAL: Failed to delete {} after a failed conversion.", item.itemKey(), file, cleanupEx);
                originalException.addSuppressed(cleanupEx);
            }
        }
    }
}
