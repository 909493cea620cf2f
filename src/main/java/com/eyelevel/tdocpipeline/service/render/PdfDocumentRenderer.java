package com.eyelevel.tdocpipeline.service.render;

import com.eyelevel.tdocpipeline.exception.ConversionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Renders PDFs from their text layer with PDFBox. Each page becomes a {@code <section>} and
 * each detected paragraph a {@code <p>}; scanned pages without text produce empty sections.
 */
@Slf4j
@Component
public class PdfDocumentRenderer implements DocumentRenderer {

    private static final String PARAGRAPH_BREAK = "\n\n";

    @Override
    public boolean supports(String extension) {
        return "pdf".equals(extension);
    }

    @Override
    public Document render(Path source) {
        String fileName = source.getFileName().toString();
        try (PDDocument pdf = Loader.loadPDF(source.toFile())) {
            String title = pdf.getDocumentInformation().getTitle();
            Document html = DocumentRenderer.newHtmlDocument(
                    title == null || title.isBlank() ? FilenameUtils.getBaseName(fileName) : title.strip());
            if (title != null && !title.isBlank()) {
                html.body().appendElement("h1").text(title.strip());
            }

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");
            stripper.setParagraphEnd(PARAGRAPH_BREAK);

            int pageCount = pdf.getNumberOfPages();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                appendPage(html, page, stripper.getText(pdf));
            }
            log.debug("Rendered {} page(s) of '{}'.", pageCount, fileName);
            return html;
        } catch (InvalidPasswordException e) {
            throw new ConversionException("PDF '" + fileName + "' is password protected", e);
        } catch (IOException e) {
            throw new ConversionException("Failed to read PDF '" + fileName + "': " + e.getMessage(), e);
        }
    }

    private void appendPage(Document html, int page, String text) {
        Element section = html.body().appendElement("section").attr("data-page", String.valueOf(page));
        for (String paragraph : text.split("\\n\\s*\\n")) {
            String normalized = paragraph.replace('\n', ' ').strip();
            if (!normalized.isEmpty()) {
                section.appendElement("p").text(normalized);
            }
        }
    }
}
