package com.eyelevel.tdocpipeline.service.extract;

import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.exception.ArchiveException;
import com.eyelevel.tdocpipeline.model.ExtractedFileItem;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Reads ZIP archives with {@link ZipFile} and streams each entry straight to its file below the
 * target directory. Directories, empty entries and operating-system metadata (macOS resource
 * forks, Finder and Explorer caches) are dropped; an entry whose path would land outside the
 * target directory rejects the whole archive.
 * <p>
 * Entry names are read as UTF-8 first. Archives built on Windows often store names in the legacy
 * IBM437 code page without flagging it; those are reopened with that charset.
 */
@Slf4j
@Component
public class ZipArchiveOpener implements ArchiveOpener {

    static final Charset LEGACY_ENTRY_CHARSET = Charset.forName("Cp437");

    private final Set<String> ignoredEntries;

    public ZipArchiveOpener(PipelineProperties properties) {
        this.ignoredEntries = Set.copyOf(properties.getExtract().getIgnoredEntries());
    }

    @Override
    public List<ExtractedFileItem> open(Path archive, Path targetDirectory) {
        final Path root = targetDirectory.toAbsolutePath().normalize();
        try (ZipFile zipFile = openZipFile(archive)) {
            List<ExtractedFileItem> items = new ArrayList<>();
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                String normalizedPath = entry.getName().replace('\\', '/');
                if (shouldSkipEntry(entry, normalizedPath)) {
                    continue;
                }
                String relativePath = safeRelativePath(normalizedPath);
                ExtractedFileItem item = writeEntry(zipFile, entry, relativePath, root);
                if (item != null) {
                    items.add(item);
                }
            }
            if (items.isEmpty()) {
                throw new ArchiveException("Archive contains no extractable entries");
            }
            return items;
        } catch (ZipException e) {
            throw new ArchiveException("Invalid ZIP file: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ArchiveException("Failed to read archive " + archive.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private ZipFile openZipFile(Path archive) throws IOException {
        try {
            return new ZipFile(archive.toFile());
        } catch (ZipException utf8Failure) {
            try {
                ZipFile legacy = new ZipFile(archive.toFile(), LEGACY_ENTRY_CHARSET);
                log.debug("Reading entry names of {} as {}.", archive.getFileName(), LEGACY_ENTRY_CHARSET);
                return legacy;
            } catch (ZipException legacyFailure) {
                utf8Failure.addSuppressed(legacyFailure);
                throw utf8Failure;
            }
        }
    }

    /**
     * Streams one entry to disk. Returns {@code null} for an entry without content.
     */
    private ExtractedFileItem writeEntry(ZipFile zipFile, ZipEntry entry, String relativePath,
                                         Path targetDirectory) throws IOException {
        Path target = targetDirectory.resolve(relativePath).normalize();
        if (!target.startsWith(targetDirectory)) {
            throw new ArchiveException("Archive entry escapes the extraction directory: " + relativePath);
        }
        Files.createDirectories(target.getParent());
        long size;
        try (InputStream inputStream = zipFile.getInputStream(entry)) {
            size = Files.copy(inputStream, target, StandardCopyOption.REPLACE_EXISTING);
        }
        if (size == 0) {
            log.debug("Ignoring empty entry '{}' in {}", relativePath, zipFile.getName());
            Files.delete(target);
            return null;
        }
        return new ExtractedFileItem(relativePath, target, size);
    }

    /**
     * Determines whether a given ZIP entry should be skipped based on its name and type.
     */
    private boolean shouldSkipEntry(ZipEntry entry, String normalizedPath) {
        if (entry.isDirectory() || normalizedPath.endsWith("/")) {
            return true;
        }
        final String fileName = FilenameUtils.getName(normalizedPath);
        final String rootDir = normalizedPath.contains("/")
                               ? normalizedPath.substring(0, normalizedPath.indexOf('/'))
                               : "";
        return ignoredEntries.contains(fileName) || ignoredEntries.contains(rootDir) || fileName.startsWith("._");
    }

    private String safeRelativePath(String normalizedPath) {
        String normalized = FilenameUtils.normalize(normalizedPath, true);
        if (normalized == null || normalized.isEmpty() || FilenameUtils.getPrefixLength(normalized) != 0) {
            throw new ArchiveException("Archive entry escapes the extraction directory: " + normalizedPath);
        }
        return normalized;
    }
}
