package com.eyelevel.tdocpipeline.service.download;

import com.eyelevel.tdocpipeline.PipelineTestSupport;
import com.eyelevel.tdocpipeline.exception.TransportException;
import com.eyelevel.tdocpipeline.model.DownloadRecord;
import com.eyelevel.tdocpipeline.model.StageResult;
import com.eyelevel.tdocpipeline.model.StageStatus;
import com.eyelevel.tdocpipeline.skip.DownloadSkipPredicate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class DownloadWorkerTest {

    private static final URI SOURCE = URI.create("http://example.invalid/Docs/R1-2400001.zip");

    @TempDir
    Path root;

    private DownloadWorker worker(ArchiveDownloader downloader) {
        return new DownloadWorker(new DownloadSkipPredicate(PipelineTestSupport.properties(root)), downloader);
    }

    private DownloadRecord record() {
        return new DownloadRecord("R1-2400001", SOURCE, root.resolve("R1-2400001.zip"));
    }

    private static long write(Path target, byte[] bytes) {
        try {
            Files.write(target, bytes);
            return bytes.length;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Test
    void completedTransferIsMovedOntoTheFinalName() throws Exception {
        byte[] payload = new byte[2048];
        DownloadRecord record = record();

        StageResult result = worker((source, target) -> write(target, payload)).process(record);

        assertEquals(StageStatus.SUCCESS, result.getStatus());
        assertEquals("2048 bytes (0.00 MB)", result.getMessage());
        assertArrayEquals(payload, Files.readAllBytes(record.localPath()));
        assertFalse(Files.exists(DownloadWorker.partialPath(record.localPath())));
    }

    @Test
    void interruptedTransferLeavesNothingBehind() {
        DownloadRecord record = record();

        StageResult result = worker((source, target) -> {
            write(target, new byte[]{1, 2, 3});
            throw new TransportException("Connection reset while transferring " + source);
        }).process(record);

        assertEquals(StageStatus.FAILED, result.getStatus());
        assertEquals("Connection reset while transferring " + SOURCE, result.getMessage());
        assertFalse(Files.exists(record.localPath()));
        assertFalse(Files.exists(DownloadWorker.partialPath(record.localPath())));
    }

    @Test
    void staleStubIsRemovedWhenTheRetryFails() throws Exception {
        DownloadRecord record = record();
        Files.createFile(record.localPath());

        StageResult result = worker((source, target) -> {
            throw new TransportException("HTTP 503 Service Unavailable from " + source);
        }).process(record);

        assertEquals(StageStatus.FAILED, result.getStatus());
        assertFalse(Files.exists(record.localPath()));
    }

    @Test
    void unexpectedErrorIsReportedAndCleanedUp() {
        DownloadRecord record = record();

        StageResult result = worker((source, target) -> {
            write(target, new byte[]{1});
            throw new IllegalStateException("boom");
        }).process(record);

        assertEquals(StageStatus.FAILED, result.getStatus());
        assertEquals("Download failed: boom", result.getMessage());
        assertFalse(Files.exists(DownloadWorker.partialPath(record.localPath())));
    }

    @Test
    void existingArchiveIsSkippedWithoutTransfer() throws Exception {
        DownloadRecord record = record();
        Files.write(record.localPath(), new byte[]{42});
        AtomicInteger calls = new AtomicInteger();

        StageResult result = worker((source, target) -> {
            calls.incrementAndGet();
            return 0;
        }).process(record);

        assertEquals(StageStatus.SKIPPED, result.getStatus());
        assertEquals(0, calls.get());
        assertArrayEquals(new byte[]{42}, Files.readAllBytes(record.localPath()));
    }
}
