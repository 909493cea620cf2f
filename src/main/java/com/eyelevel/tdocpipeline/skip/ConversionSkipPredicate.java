package com.eyelevel.tdocpipeline.skip;

import com.eyelevel.tdocpipeline.model.ConversionUnit;
import org.springframework.stereotype.Component;

import java.nio.file.Files;

/**
 * A conversion is done only when both renditions exist. A single orphan rendition is treated
 * as incomplete and both are regenerated.
 */
@Component
public class ConversionSkipPredicate implements SkipPredicate<ConversionUnit> {

    @Override
    public SkipDecision evaluate(ConversionUnit item) {
        if (Files.isRegularFile(item.richLayoutPath()) && Files.isRegularFile(item.structuredTextPath())) {
            return SkipDecision.skip("Already converted");
        }
        return SkipDecision.process();
    }
}
