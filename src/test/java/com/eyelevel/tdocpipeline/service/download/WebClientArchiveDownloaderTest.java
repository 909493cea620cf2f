package com.eyelevel.tdocpipeline.service.download;

import com.eyelevel.tdocpipeline.PipelineTestSupport;
import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.config.WebClientConfig;
import com.eyelevel.tdocpipeline.exception.TransportException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebClientArchiveDownloaderTest {

    private static final byte[] ARCHIVE = new byte[64 * 1024];

    @TempDir
    Path root;

    private HttpServer server;
    private ExecutorService serverExecutor;
    private WebClientArchiveDownloader downloader;

    @BeforeEach
    void setUp() throws Exception {
        for (int i = 0; i < ARCHIVE.length; i++) {
            ARCHIVE[i] = (byte) i;
        }
        serverExecutor = Executors.newCachedThreadPool();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/Docs/R1-2400001.zip", exchange -> {
            exchange.sendResponseHeaders(200, ARCHIVE.length);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write(ARCHIVE);
            }
        });
        server.createContext("/Docs/R1-2400002.zip", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.createContext("/Docs/R1-2400003.zip", exchange -> {
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream body = exchange.getResponseBody()) {
                body.write(new byte[512]);
                body.flush();
                Thread.sleep(4000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        server.setExecutor(serverExecutor);
        server.start();

        PipelineProperties properties = PipelineTestSupport.properties(root);
        properties.getDownload().setResponseTimeoutSeconds(1);
        properties.getDownload().setTransferTimeoutSeconds(1);
        downloader = new WebClientArchiveDownloader(WebClientConfig.buildWebClient(properties), properties);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    private URI uri(String name) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/Docs/" + name);
    }

    @Test
    void streamsTheResponseBodyToDisk() throws Exception {
        Path target = root.resolve("R1-2400001.zip.part");

        long bytes = downloader.download(uri("R1-2400001.zip"), target);

        assertEquals(ARCHIVE.length, bytes);
        assertArrayEquals(ARCHIVE, Files.readAllBytes(target));
    }

    @Test
    void notFoundIsATransportFailure() {
        Path target = root.resolve("R1-2400002.zip.part");

        TransportException error = assertThrows(TransportException.class,
                () -> downloader.download(uri("R1-2400002.zip"), target));

        assertTrue(error.getMessage().startsWith("HTTP 404"), error.getMessage());
        assertFalse(Files.exists(target));
    }

    @Test
    void stalledTransferTimesOut() {
        Path target = root.resolve("R1-2400003.zip.part");

        assertThrows(TransportException.class, () -> downloader.download(uri("R1-2400003.zip"), target));
        assertFalse(Files.exists(target));
    }

    @Test
    void refusedConnectionIsATransportFailure() {
        Path target = root.resolve("R1-2400004.zip.part");

        assertThrows(TransportException.class,
                () -> downloader.download(URI.create("http://127.0.0.1:1/Docs/R1-2400004.zip"), target));
        assertFalse(Files.exists(target));
    }
}
