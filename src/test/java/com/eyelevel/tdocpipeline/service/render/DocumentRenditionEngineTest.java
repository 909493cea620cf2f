package com.eyelevel.tdocpipeline.service.render;

import com.eyelevel.tdocpipeline.PipelineTestSupport;
import com.eyelevel.tdocpipeline.exception.ConversionException;
import com.eyelevel.tdocpipeline.model.Rendition;
import org.jodconverter.core.office.OfficeManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentRenditionEngineTest {

    @TempDir
    Path root;

    private DocumentRenditionEngine engine;

    @BeforeEach
    void setUp() {
        OfficeDocumentRenderer office = new OfficeDocumentRenderer(
                new StaticListableBeanFactory().getBeanProvider(OfficeManager.class));
        DocumentRendererFactory factory = new DocumentRendererFactory(List.of(new PdfDocumentRenderer(), office));
        engine = new DocumentRenditionEngine(factory, new HtmlMarkdownConverter());
    }

    @Test
    void pdfProducesBothRenditionsFromOneRender() throws Exception {
        Path pdf = Files.write(root.resolve("R1-2400001.PDF"), PipelineTestSupport.pdfBytes("Scope of the study"));

        Rendition rendition = engine.render(pdf);

        assertTrue(rendition.isComplete());
        assertTrue(rendition.richLayout().contains("data-page=\"1\""));
        assertTrue(rendition.richLayout().contains("charset=\"UTF-8\""));
        assertTrue(rendition.structuredText().contains("Scope of the study"));
    }

    @Test
    void officeDocumentWithoutLibreOfficeFailsWithReason() throws Exception {
        Path docx = Files.writeString(root.resolve("R1-2400002.docx"), "docx");

        ConversionException error = assertThrows(ConversionException.class, () -> engine.render(docx));

        assertTrue(error.getMessage().contains("LibreOffice is not enabled"), error.getMessage());
    }

    @Test
    void unknownKindIsRejected() throws Exception {
        Path text = Files.writeString(root.resolve("notes.txt"), "text");

        assertThrows(ConversionException.class, () -> engine.render(text));
    }
}
