package com.eyelevel.tdocpipeline.storage;

import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.exception.FatalSetupException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Path-naming convention shared by every stage and skip predicate. The layout below the root is
 * the only persisted state of the pipeline and doubles as its resume ledger:
 * <pre>
 * {root}/downloads/{id}.{ext}
 * {root}/extracted/{id}/...
 * {root}/output/{richLayout.dir}/{id}_{basename}.{richLayout.ext}
 * {root}/output/{structuredText.dir}/{id}_{basename}.{structuredText.ext}
 * {root}/staging/...
 * </pre>
 */
@Slf4j
@Component
public class ArtifactStore {

    static final String DOWNLOADS = "downloads";
    static final String EXTRACTED = "extracted";
    static final String OUTPUT = "output";
    static final String STAGING = "staging";

    private final Path root;
    private final String archiveExtension;
    private final PipelineProperties.Rendition richLayout;
    private final PipelineProperties.Rendition structuredText;
    private final Set<String> supportedExtensions;

    public ArtifactStore(PipelineProperties properties) {
        this.root = properties.rootPath().toAbsolutePath().normalize();
        this.archiveExtension = properties.getDownload().getArchiveExtension();
        this.richLayout = properties.getConvert().getRichLayout();
        this.structuredText = properties.getConvert().getStructuredText();
        this.supportedExtensions = properties.getConvert().getSupportedExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Creates every directory of the layout that does not exist yet.
     *
     * @throws FatalSetupException if a directory cannot be created
     */
    public void ensureLayout() {
        for (Path directory : List.of(downloadDirectory(), extractDirectory(), richLayoutDirectory(),
                structuredTextDirectory(), stagingDirectory())) {
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new FatalSetupException("Failed to create storage directory: " + directory, e);
            }
        }
        log.info("Download directory: {}", downloadDirectory());
        log.info("Extract directory:  {}", extractDirectory());
        log.info("Output directory:   {}", root.resolve(OUTPUT));
    }

    public Path root() {
        return root;
    }

    public Path downloadDirectory() {
        return root.resolve(DOWNLOADS);
    }

    public Path extractDirectory() {
        return root.resolve(EXTRACTED);
    }

    public Path richLayoutDirectory() {
        return root.resolve(OUTPUT).resolve(richLayout.getDirectory());
    }

    public Path structuredTextDirectory() {
        return root.resolve(OUTPUT).resolve(structuredText.getDirectory());
    }

    public Path stagingDirectory() {
        return root.resolve(STAGING);
    }

    public String archiveFileName(String artifactId) {
        return artifactId + "." + archiveExtension;
    }

    public Path downloadPath(String artifactId) {
        return downloadDirectory().resolve(archiveFileName(artifactId));
    }

    public Path extractionDirectory(String artifactId) {
        return extractDirectory().resolve(artifactId);
    }

    /**
     * Where an archive is unpacked before the result is moved onto {@link #extractionDirectory(String)}.
     */
    public Path extractionStagingDirectory(String artifactId) {
        return stagingDirectory().resolve("extract-" + artifactId);
    }

    public Path richLayoutPath(String artifactId, Path document) {
        return richLayoutDirectory().resolve(outputBaseName(artifactId, document) + "." + richLayout.getExtension());
    }

    public Path structuredTextPath(String artifactId, Path document) {
        return structuredTextDirectory().resolve(outputBaseName(artifactId, document) + "." + structuredText.getExtension());
    }

    /**
     * Checks a file name against the allow-list of recognized document kinds.
     */
    public boolean isSupportedDocument(Path file) {
        String extension = FilenameUtils.getExtension(file.getFileName().toString());
        return supportedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * Lists every document of a recognized kind inside an artifact's extraction directory,
     * in a stable (sorted) order. A missing directory yields an empty list.
     */
    public List<Path> listDocuments(String artifactId) {
        Path directory = extractionDirectory(artifactId);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(this::isSupportedDocument)
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            log.error("[{}] Failed to enumerate documents in {}.", artifactId, directory, e);
            return List.of();
        }
    }

    private String outputBaseName(String artifactId, Path document) {
        return artifactId + "_" + FilenameUtils.getBaseName(document.getFileName().toString());
    }
}
