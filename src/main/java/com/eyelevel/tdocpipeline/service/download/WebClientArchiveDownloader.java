package com.eyelevel.tdocpipeline.service.download;

import com.eyelevel.tdocpipeline.config.PipelineProperties;
import com.eyelevel.tdocpipeline.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Streams archives over HTTP with {@link WebClient}, writing body buffers straight to disk.
 * Transport failures are retried with a fixed back-off; each attempt starts from an empty file.
 */
@Slf4j
@Service
public class WebClientArchiveDownloader implements ArchiveDownloader {

    private final WebClient webClient;
    private final Duration transferTimeout;

    public WebClientArchiveDownloader(@Qualifier("pipelineWebClient") WebClient webClient,
                                      PipelineProperties properties) {
        this.webClient = webClient;
        this.transferTimeout = Duration.ofSeconds(properties.getDownload().getTransferTimeoutSeconds());
        PipelineProperties.RetryConfig retry = properties.getDownload().getRetry();
        log.info("Archive downloader ready. Transfer timeout: {} s, retries: {} every {} ms",
                transferTimeout.toSeconds(), retry.getAttempts(), retry.getDelayMs());
    }

    @Override
    @Retryable(retryFor = TransportException.class,
               maxAttemptsExpression = "#{${app.pipeline.download.retry.attempts:2} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.pipeline.download.retry.delay-ms:2000}}"),
               listeners = {"downloadRetryListener"})
    public long download(URI source, Path target) {
        log.debug("Downloading {} to {}", source, target);
        try {
            Flux<DataBuffer> body = webClient.get()
                    .uri(source)
                    .retrieve()
                    .bodyToFlux(DataBuffer.class);

            DataBufferUtils.write(body, target,
                            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)
                    .timeout(transferTimeout)
                    .block();

            return Files.size(target);
        } catch (IOException e) {
            deletePartial(target, e);
            throw new TransportException("Failed to store " + source + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            TransportException mapped = mapException(source, Exceptions.unwrap(e));
            deletePartial(target, mapped);
            throw mapped;
        }
    }

    @Recover
    public long recover(TransportException e, URI source, Path target) {
        log.error("Download of {} failed after all retry attempts.", source);
        throw e;
    }

    /**
     * Maps a transport error to a {@link TransportException} with a readable reason.
     */
    private TransportException mapException(URI source, Throwable error) {
        if (error instanceof TransportException transportError) {
            return transportError;
        } else if (error instanceof WebClientResponseException responseError) {
            return new TransportException("HTTP " + responseError.getStatusCode().value() + " "
                    + responseError.getStatusText() + " from " + source, responseError);
        } else if (error instanceof WebClientRequestException || error instanceof ConnectException
                   || error instanceof UnknownHostException) {
            return new TransportException("Failed to connect to " + source + ": " + error.getMessage(), error);
        } else if (error instanceof TimeoutException) {
            return new TransportException("Transfer of " + source + " timed out after "
                    + transferTimeout.toSeconds() + " s", error);
        } else if (error instanceof IOException) {
            return new TransportException("I/O error while transferring " + source + ": " + error.getMessage(), error);
        }
        return new TransportException("Unexpected error while transferring " + source + ": " + error.getMessage(), error);
    }

    private void deletePartial(Path target, Exception originalException) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException cleanupEx) {
            log.error("Failed to delete partial download: {}", target, cleanupEx);
            originalException.addSuppressed(cleanupEx);
        }
    }
}
