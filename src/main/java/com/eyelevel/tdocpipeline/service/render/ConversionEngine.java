package com.eyelevel.tdocpipeline.service.render;

import com.eyelevel.tdocpipeline.exception.ConversionException;
import com.eyelevel.tdocpipeline.model.Rendition;

import java.nio.file.Path;

/**
 * Renders one document into both of its textual representations in a single call, so the two
 * can never diverge in completeness. No retry is attempted.
 */
public interface ConversionEngine {

    /**
     * @param document the extracted document
     * @return the HTML and Markdown renditions
     * @throws ConversionException carrying the engine's reason when the document cannot be rendered
     */
    Rendition render(Path document);
}
