package com.eyelevel.tdocpipeline.skip;

import com.eyelevel.tdocpipeline.model.ExtractionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * An extraction is done when the destination directory exists and is non-empty.
 * An empty directory is a leftover of a failed attempt and is processed again.
 */
@Slf4j
@Component
public class ExtractionSkipPredicate implements SkipPredicate<ExtractionRecord> {

    @Override
    public SkipDecision evaluate(ExtractionRecord item) {
        Path destination = item.destinationDirectory();
        if (!Files.isDirectory(destination)) {
            return SkipDecision.process();
        }
        try (Stream<Path> children = Files.list(destination)) {
            if (children.findAny().isPresent()) {
                return SkipDecision.skip("Already extracted");
            }
            log.info("[{}] Destination {} exists but is empty. Extracting again.", item.artifactId(), destination);
            return SkipDecision.process();
        } catch (IOException e) {
            log.warn("[{}] Could not list {}. Extracting again.", item.artifactId(), destination, e);
            return SkipDecision.process();
        }
    }
}
