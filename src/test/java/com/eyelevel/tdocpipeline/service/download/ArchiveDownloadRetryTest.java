package com.eyelevel.tdocpipeline.service.download;

import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.exception.TransportException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = {
        "app.pipeline.run-on-startup=false",
        "app.pipeline.download.retry.attempts=2",
        "app.pipeline.download.retry.delay-ms=10"
})
class ArchiveDownloadRetryTest {

    @Autowired
    private ArchiveDownloader downloader;

    @Autowired
    private PipelineProperties properties;

    @TempDir
    Path root;

    private HttpServer server;
    private final AtomicInteger flakyHits = new AtomicInteger();
    private final AtomicInteger brokenHits = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/Docs/R1-2400001.zip", exchange -> {
            if (flakyHits.incrementAndGet() < 3) {
                exchange.sendResponseHeaders(503, -1);
                exchange.close();
                return;
            }
            byte[] body = {'P', 'K', 3, 4};
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/Docs/R1-2400002.zip", exchange -> {
            brokenHits.incrementAndGet();
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private URI uri(String name) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/Docs/" + name);
    }

    @Test
    void transientFailuresAreRetried() throws Exception {
        Path target = root.resolve("R1-2400001.zip.part");

        long bytes = downloader.download(uri("R1-2400001.zip"), target);

        assertEquals(4, bytes);
        assertEquals(3, flakyHits.get());
        assertEquals(4, Files.size(target));
    }

    @Test
    void persistentFailureSurfacesAfterAllAttempts() {
        Path target = root.resolve("R1-2400002.zip.part");

        TransportException error = assertThrows(TransportException.class,
                () -> downloader.download(uri("R1-2400002.zip"), target));

        assertEquals(properties.getDownload().getRetry().getAttempts() + 1, brokenHits.get());
        assertTrue(error.getMessage().startsWith("HTTP 503"), error.getMessage());
        assertFalse(Files.exists(target));
    }
}
