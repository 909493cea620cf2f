package com.eyelevel.tdocpipeline.service.render;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Finds the {@link DocumentRenderer} for a given file extension. It keeps every available
 * renderer and returns the first one that supports the extension.
 */
@Component
@Slf4j
public class DocumentRendererFactory {

    private final List<DocumentRenderer> renderers;

    public DocumentRendererFactory(List<DocumentRenderer> renderers) {
        this.renderers = renderers;
        log.info("DocumentRendererFactory initialized with {} available renderers.", renderers.size());
    }

    public Optional<DocumentRenderer> getRenderer(String extension) {
        Optional<DocumentRenderer> renderer = renderers.stream()
                .filter(r -> r.supports(extension))
                .findFirst();
        log.debug("Searching for renderer for extension '{}'. Found: {}", extension,
                renderer.map(r -> r.getClass().getSimpleName()).orElse("None"));
        return renderer;
    }
}
