package com.eyelevel.tdocpipeline.model;

import java.nio.file.Path;

/**
 * One extracted document and the two renditions it produces.
 *
 * @param artifactId         the archive the document came from
 * @param sourceDocument     the extracted document
 * @param richLayoutPath     output path of the HTML rendition
 * @param structuredTextPath output path of the Markdown rendition
 */
public record ConversionUnit(String artifactId, Path sourceDocument, Path richLayoutPath,
                             Path structuredTextPath) implements StageItem {

    @Override
    public String itemKey() {
        return artifactId + "/" + sourceDocument.getFileName();
    }
}
