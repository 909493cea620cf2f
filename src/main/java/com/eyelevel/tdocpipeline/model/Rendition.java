package com.eyelevel.tdocpipeline.model;

/**
 * Both representations of one rendered document, produced together by a single engine call.
 *
 * @param richLayout     HTML rendition
 * @param structuredText Markdown rendition
 */
public record Rendition(String richLayout, String structuredText) {

    public boolean isComplete() {
        return richLayout != null && structuredText != null;
    }
}
