package com.eyelevel.tdocpipeline.service.render;

import com.eyelevel.tdocpipeline.exception.ConversionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.jodconverter.core.office.OfficeException;
import org.jodconverter.core.office.OfficeManager;
import org.jodconverter.local.LocalConverter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.safety.Safelist;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Renders Word, PowerPoint and Excel documents through LibreOffice's HTML export and strips the
 * result down to structural markup. Requires the managed office process
 * ({@code app.jodconverter.enabled=true}); without it every Office document fails with that reason.
 */
@Slf4j
@Component
public class OfficeDocumentRenderer implements DocumentRenderer {

    private static final Set<String> OFFICE_EXTENSIONS = Set.of(
            "doc", "docx", "ppt", "pptx", "xls", "xlsx", "rtf", "odt", "ods", "odp");

    private final ObjectProvider<OfficeManager> officeManagerProvider;

    public OfficeDocumentRenderer(ObjectProvider<OfficeManager> officeManagerProvider) {
        this.officeManagerProvider = officeManagerProvider;
    }

    @Override
    public boolean supports(String extension) {
        return OFFICE_EXTENSIONS.contains(extension);
    }

    @Override
    public Document render(Path source) {
        OfficeManager officeManager = officeManagerProvider.getIfAvailable();
        String fileName = source.getFileName().toString();
        if (officeManager == null) {
            throw new ConversionException("LibreOffice is not enabled (app.jodconverter.enabled=false); cannot render '"
                    + fileName + "'");
        }

        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("office-render-");
            File output = workDir.resolve(FilenameUtils.getBaseName(fileName) + ".html").toFile();
            log.debug("Attempting LibreOffice HTML export for '{}'.", fileName);
            LocalConverter.make(officeManager).convert(source.toFile()).to(output).execute();

            if (!output.exists() || output.length() == 0) {
                throw new ConversionException("LibreOffice produced an empty rendition for '" + fileName + "'");
            }
            Document exported = Jsoup.parse(output, null);
            Document html = DocumentRenderer.newHtmlDocument(FilenameUtils.getBaseName(fileName));
            html.body().html(Jsoup.clean(exported.body().html(), Safelist.relaxed()));
            return html;
        } catch (OfficeException e) {
            throw new ConversionException("LibreOffice conversion failed for '" + fileName + "': " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConversionException("Failed to read LibreOffice output for '" + fileName + "': " + e.getMessage(), e);
        } finally {
            deleteWorkDir(workDir);
        }
    }

    private void deleteWorkDir(Path workDir) {
        if (workDir != null) {
            try {
                FileUtils.deleteDirectory(workDir.toFile());
            } catch (IOException e) {
                log.error("Failed to delete temporary render directory: {}", workDir, e);
            }
        }
    }
}
