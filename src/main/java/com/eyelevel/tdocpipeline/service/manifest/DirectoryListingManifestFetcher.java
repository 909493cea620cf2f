package com.eyelevel.tdocpipeline.service.manifest;

import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.exception.ManifestException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads an HTML directory listing and turns every link whose target matches the configured
 * archive pattern into an identifier (the archive's file name without extension).
 */
@Slf4j
@Service
public class DirectoryListingManifestFetcher implements ManifestFetcher {

    private final WebClient webClient;
    private final Pattern archivePattern;
    private final Duration timeout;

    public DirectoryListingManifestFetcher(@Qualifier("pipelineWebClient") WebClient webClient,
                                           PipelineProperties properties) {
        this.webClient = webClient;
        this.timeout = Duration.ofSeconds(properties.getManifest().getTimeoutSeconds());
        try {
            this.archivePattern = Pattern.compile(properties.getArchivePattern());
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid archive pattern: " + properties.getArchivePattern(), e);
        }
    }

    @Override
    public List<String> fetch(URI source) {
        log.info("Fetching document list from: {}", source);
        String html = download(source);
        List<String> identifiers = parse(html, source);
        log.info("Found {} archive(s) in the manifest.", identifiers.size());
        return identifiers;
    }

    private String download(URI source) {
        try {
            String body = webClient.get()
                    .uri(source)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            if (body == null) {
                throw new ManifestException("Manifest at " + source + " returned an empty body");
            }
            return body;
        } catch (ManifestException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof WebClientResponseException responseError) {
                throw new ManifestException("Manifest request to " + source + " failed with HTTP "
                        + responseError.getStatusCode().value(), responseError);
            } else if (cause instanceof WebClientRequestException || cause instanceof TimeoutException) {
                throw new ManifestException("Manifest at " + source + " is unreachable: " + cause.getMessage(), cause);
            }
            throw new ManifestException("Failed to fetch manifest from " + source + ": " + cause.getMessage(), cause);
        }
    }

    List<String> parse(String html, URI source) {
        final Document document;
        try {
            document = Jsoup.parse(html, source.toString());
        } catch (RuntimeException e) {
            throw new ManifestException("Manifest at " + source + " is not parseable HTML", e);
        }

        Set<String> identifiers = new LinkedHashSet<>();
        for (Element link : document.select("a[href]")) {
            Matcher matcher = archivePattern.matcher(link.attr("href"));
            if (matcher.find()) {
                String fileName = matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group();
                String identifier = FilenameUtils.getBaseName(fileName);
                if (!identifiers.add(identifier)) {
                    log.debug("Ignoring duplicate manifest entry '{}'.", identifier);
                }
            }
        }
        return new ArrayList<>(identifiers);
    }
}
