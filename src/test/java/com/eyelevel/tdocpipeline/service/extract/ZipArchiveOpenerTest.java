package com.eyelevel.tdocpipeline.service.extract;

import com.eyelevel.tdocpipeline.PipelineTestSupport;
import com.eyelevel.tdocpipeline.exception.ArchiveException;
import com.eyelevel.tdocpipeline.model.ExtractedFileItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static com.eyelevel.tdocpipeline.PipelineTestSupport.utf8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ZipArchiveOpenerTest {

    @TempDir
    Path root;

    private Path target;

    @BeforeEach
    void setUp() throws Exception {
        target = Files.createDirectories(root.resolve("staging"));
    }

    private ZipArchiveOpener opener() {
        return new ZipArchiveOpener(PipelineTestSupport.properties(root));
    }

    @Test
    void streamsEntriesToDiskAndDropsDirectoriesMetadataAndEmptyEntries() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("R1-2400001/", null);
        entries.put("R1-2400001/R1-2400001.docx", utf8("docx"));
        entries.put("__MACOSX/R1-2400001/._R1-2400001.docx", utf8("fork"));
        entries.put("R1-2400001/.DS_Store", utf8("finder"));
        entries.put("R1-2400001/._hidden.pdf", utf8("fork"));
        entries.put("Thumbs.db", utf8("cache"));
        entries.put("R1-2400001/empty.pdf", new byte[0]);
        entries.put("summary.pdf", utf8("pdf"));
        Path archive = PipelineTestSupport.writeZip(root.resolve("R1-2400001.zip"), entries);

        List<ExtractedFileItem> items = opener().open(archive, target);

        assertEquals(List.of("R1-2400001/R1-2400001.docx", "summary.pdf"),
                items.stream().map(ExtractedFileItem::getRelativePath).toList());
        assertEquals(target.resolve("R1-2400001/R1-2400001.docx"), items.get(0).getLocation());
        assertEquals(4, items.get(0).getSize());
        assertEquals("docx", Files.readString(target.resolve("R1-2400001/R1-2400001.docx")));
        assertFalse(Files.exists(target.resolve("R1-2400001/empty.pdf")));
        assertFalse(Files.exists(target.resolve("__MACOSX")));
        assertFalse(Files.exists(target.resolve("Thumbs.db")));
    }

    @Test
    void legacyEncodedEntryNamesAreExtracted() throws Exception {
        Charset cp437 = Charset.forName("Cp437");
        Path archive = root.resolve("R1-2400005.zip");
        try (OutputStream out = Files.newOutputStream(archive);
             ZipOutputStream zip = new ZipOutputStream(out, cp437)) {
            zip.putNextEntry(new ZipEntry("R1-2400005 Übersicht.docx"));
            zip.write(utf8("docx"));
            zip.closeEntry();
        }

        List<ExtractedFileItem> items = opener().open(archive, target);

        assertEquals(1, items.size());
        assertEquals("R1-2400005 Übersicht.docx", items.get(0).getRelativePath());
        assertEquals("docx", Files.readString(target.resolve("R1-2400005 Übersicht.docx")));
    }

    @Test
    void corruptArchiveIsRejected() throws Exception {
        Path archive = Files.write(root.resolve("R1-2400002.zip"), utf8("<html>Not Found</html>"));

        ArchiveException error = assertThrows(ArchiveException.class, () -> opener().open(archive, target));

        assertTrue(error.getMessage().startsWith("Invalid ZIP file"), error.getMessage());
    }

    @Test
    void archiveWithoutContentIsRejected() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("__MACOSX/._x", utf8("fork"));
        entries.put("docs/", null);
        entries.put("docs/empty.pdf", new byte[0]);
        Path archive = PipelineTestSupport.writeZip(root.resolve("R1-2400003.zip"), entries);

        ArchiveException error = assertThrows(ArchiveException.class, () -> opener().open(archive, target));

        assertEquals("Archive contains no extractable entries", error.getMessage());
    }

    @Test
    void pathTraversalEntryRejectsTheArchive() throws Exception {
        Map<String, byte[]> entries = new LinkedHashMap<>();
        entries.put("ok.pdf", utf8("pdf"));
        entries.put("../../escape.pdf", utf8("evil"));
        Path archive = PipelineTestSupport.writeZip(root.resolve("R1-2400004.zip"), entries);

        assertThrows(ArchiveException.class, () -> opener().open(archive, target));
        assertFalse(Files.exists(root.resolve("escape.pdf")));
        assertFalse(Files.exists(root.getParent().resolve("escape.pdf")));
    }
}
