package com.eyelevel.tdocpipeline.skip;

import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.model.DownloadRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A download is done when the archive exists under its final name with at least the configured
 * minimum size. A zero-byte stub left by an interrupted run is fetched again.
 */
@Slf4j
@Component
public class DownloadSkipPredicate implements SkipPredicate<DownloadRecord> {

    private final long minimumBytes;

    public DownloadSkipPredicate(PipelineProperties properties) {
        this.minimumBytes = properties.getDownload().getMinimumBytes();
    }

    @Override
    public SkipDecision evaluate(DownloadRecord item) {
        Path target = item.localPath();
        if (!Files.isRegularFile(target)) {
            return SkipDecision.process();
        }
        try {
            long size = Files.size(target);
            if (size < minimumBytes) {
                log.warn("[{}] Existing download is {} bytes (minimum {}). Fetching again.",
                        item.artifactId(), size, minimumBytes);
                return SkipDecision.process();
            }
            return SkipDecision.skip("Already exists");
        } catch (IOException e) {
            log.warn("[{}] Could not read size of {}. Fetching again.", item.artifactId(), target, e);
            return SkipDecision.process();
        }
    }
}
