package com.eyelevel.tdocpipeline.service.render;

import com.eyelevel.tdocpipeline.exception.ConversionException;
import com.eyelevel.tdocpipeline.model.Rendition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Default {@link ConversionEngine}: picks a {@link DocumentRenderer} by file extension, renders
 * the document to HTML once and derives the Markdown rendition from that same HTML.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRenditionEngine implements ConversionEngine {

    private final DocumentRendererFactory rendererFactory;
    private final HtmlMarkdownConverter markdownConverter;

    @Override
    public Rendition render(Path document) {
        String fileName = document.getFileName().toString();
        String extension = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
        DocumentRenderer renderer = rendererFactory.getRenderer(extension)
                .orElseThrow(() -> new ConversionException("No renderer available for file type '." + extension + "'"));

        Document html;
        try {
            html = renderer.render(document);
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConversionException("Rendering of '" + fileName + "' failed: " + e.getMessage(), e);
        }
        html.outputSettings().charset(StandardCharsets.UTF_8);

        String markdown = markdownConverter.convert(html);
        log.debug("Rendered '{}' with {} ({} chars of Markdown).", fileName,
                renderer.getClass().getSimpleName(), markdown.length());
        return new Rendition(html.outerHtml(), markdown);
    }
}
