package com.eyelevel.tdocpipeline.service.manifest;

import com.eyelevel.tdocpipeline.PipelineTestSupport;
import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.config.WebClientConfig;
import com.eyelevel.tdocpipeline.exception.ManifestException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectoryListingManifestFetcherTest {

    private static final String LISTING = """
            <html><body><table>
            <tr><td><a href="/ftp/meetings_3gpp_sync/RAN1/Docs/">Parent Directory</a></td></tr>
            <tr><td><a href="Inbox/">Inbox</a></td></tr>
            <tr><td><a href="https://www.3gpp.org/ftp/meetings_3gpp_sync/RAN1/Docs/R1-2400002.zip">R1-2400002.zip</a></td></tr>
            <tr><td><a href="R1-2400001.zip">R1-2400001.zip</a></td></tr>
            <tr><td><a href="R1-2400002.zip">R1-2400002.zip</a></td></tr>
            <tr><td><a href="R1-240003.zip">too short</a></td></tr>
            <tr><td><a href="R1-2400004.zip.md5">checksum</a></td></tr>
            <tr><td><a href="R2-2400005.zip">other group</a></td></tr>
            </table></body></html>
            """;

    @TempDir
    Path root;

    private HttpServer server;
    private DirectoryListingManifestFetcher fetcher;

    @BeforeEach
    void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/Docs/", exchange -> {
            byte[] body = LISTING.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/Broken/", exchange -> {
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        server.start();

        PipelineProperties properties = PipelineTestSupport.properties(root);
        fetcher = new DirectoryListingManifestFetcher(WebClientConfig.buildWebClient(properties), properties);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    @Test
    void keepsMatchingArchivesInListingOrderWithoutDuplicates() {
        List<String> identifiers = fetcher.fetch(uri("/Docs/"));

        assertEquals(List.of("R1-2400002", "R1-2400001"), identifiers);
    }

    @Test
    void listingWithoutArchivesIsEmpty() {
        assertTrue(fetcher.parse("<html><body><a href=\"Inbox/\">Inbox</a></body></html>",
                URI.create("http://example.invalid/")).isEmpty());
    }

    @Test
    void serverErrorIsAManifestFailure() {
        ManifestException error = assertThrows(ManifestException.class, () -> fetcher.fetch(uri("/Broken/")));

        assertTrue(error.getMessage().contains("HTTP 500"), error.getMessage());
    }

    @Test
    void unreachableSourceIsAManifestFailure() {
        assertThrows(ManifestException.class, () -> fetcher.fetch(URI.create("http://127.0.0.1:1/Docs/")));
    }
}
