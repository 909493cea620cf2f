package com.eyelevel.tdocpipeline.service.render;

import com.eyelevel.tdocpipeline.exception.ConversionException;
import org.jsoup.nodes.Document;

import java.nio.file.Path;

/**
 * Defines the contract for turning one kind of document into an HTML document.
 * Each implementation is responsible for a specific set of file extensions.
 */
public interface DocumentRenderer {

    /**
     * Determines if this renderer can process a file with the given extension.
     *
     * @param extension The lower-case file extension without dot (e.g., "pdf", "docx").
     * @return {@code true} if the renderer supports the extension, {@code false} otherwise.
     */
    boolean supports(String extension);

    /**
     * Renders the document as HTML.
     *
     * @param source The document to render.
     * @return A complete HTML document.
     * @throws ConversionException if the document cannot be read or rendered.
     */
    Document render(Path source);

    /**
     * Creates an empty UTF-8 HTML document with the given title.
     */
    static Document newHtmlDocument(String title) {
        Document document = Document.createShell("");
        document.head().appendElement("meta").attr("charset", "UTF-8");
        document.title(title);
        return document;
    }
}
