package com.eyelevel.tdocpipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Binds application properties under the "app.pipeline" prefix to a strongly-typed
 * configuration object. Every component of the pipeline receives this object at construction,
 * so a run can be pointed at any storage root and remote source without touching code.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

    /**
     * Storage root. All downloads, extractions and renditions live below this directory.
     */
    @NotBlank
    private String rootDir = "artifacts";

    /**
     * Directory listing that serves as the manifest. Archive locators are resolved against it.
     */
    @NotBlank
    private String sourceUrl = "https://www.3gpp.org/ftp/meetings_3gpp_sync/RAN1/Docs/";

    /**
     * Pattern applied to every href of the listing; group 1 must capture the archive file name.
     */
    @NotBlank
    private String archivePattern = "(R1-\\d{7}\\.zip)$";

    /**
     * Whether a manifest without identifiers aborts the run or ends it as an empty success.
     */
    private boolean failOnEmptyManifest = true;

    /**
     * Whether the pipeline runs once when the application starts.
     */
    private boolean runOnStartup = true;

    @Valid
    @NotNull
    private Manifest manifest = new Manifest();
    @Valid
    @NotNull
    private Download download = new Download();
    @Valid
    @NotNull
    private Extract extract = new Extract();
    @Valid
    @NotNull
    private Convert convert = new Convert();

    public Path rootPath() {
        return Path.of(rootDir);
    }

    public URI sourceUri() {
        return URI.create(sourceUrl);
    }

    /**
     * Transport retries of the archive downloader. The {@code @Retryable} on the downloader reads
     * the same keys and falls back to these defaults.
     */
    @Data
    public static class RetryConfig {
        /**
         * Attempts made after the first one fails.
         */
        @Min(0)
        private int attempts = 2;
        @Min(0)
        private long delayMs = 2000;
    }

    @Data
    public static class Manifest {
        @Min(1)
        private long timeoutSeconds = 30;
        @Min(1024)
        private int maxInMemoryBytes = 16 * 1024 * 1024;
    }

    @Data
    public static class Download {
        @Min(1)
        private int workers = 4;
        @Min(1)
        private int connectTimeoutMs = 10_000;
        @Min(1)
        private long responseTimeoutSeconds = 60;
        @Min(1)
        private long transferTimeoutSeconds = 600;
        /**
         * Smallest file size accepted as a finished download. Anything smaller is fetched again.
         */
        @Min(1)
        private long minimumBytes = 1;
        @NotBlank
        private String archiveExtension = "zip";
        @Valid
        @NotNull
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class Extract {
        @Min(1)
        private int workers = 4;
        private Set<String> ignoredEntries = new LinkedHashSet<>(Set.of("__MACOSX", ".DS_Store", "Thumbs.db"));
    }

    @Data
    public static class Convert {
        @Min(1)
        private int workers = 4;
        /**
         * Recognized document kinds. Only files with these extensions become conversion candidates.
         */
        private Set<String> supportedExtensions = new LinkedHashSet<>(
                Set.of("pdf", "docx", "doc", "pptx", "ppt", "xlsx", "xls"));
        @Valid
        private Rendition richLayout = new Rendition("html", "html");
        @Valid
        private Rendition structuredText = new Rendition("markdown", "md");
    }

    @Data
    public static class Rendition {
        @NotBlank
        private String directory;
        @NotBlank
        private String extension;

        public Rendition() {
        }

        public Rendition(String directory, String extension) {
            this.directory = directory;
            this.extension = extension;
        }
    }
}
