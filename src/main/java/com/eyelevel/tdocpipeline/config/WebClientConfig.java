package com.eyelevel.tdocpipeline.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Configures the {@link WebClient} used to read the manifest and to stream archives.
 * Every network operation gets a bounded connect and response wait so a stalled server
 * fails the item instead of hanging a worker.
 */
@Slf4j
@Configuration
public class WebClientConfig {

    /**
     * Creates the {@link WebClient} shared by the manifest fetcher and the archive downloader.
     *
     * @param properties pipeline configuration providing timeouts and buffer limits
     * @return a configured {@link WebClient} bean named "pipelineWebClient"
     */
    @Bean("pipelineWebClient")
    public WebClient pipelineWebClient(PipelineProperties properties) {
        PipelineProperties.Download download = properties.getDownload();
        log.info("Initializing pipeline WebClient. Connect timeout: {} ms, response timeout: {} s",
                download.getConnectTimeoutMs(), download.getResponseTimeoutSeconds());
        return buildWebClient(properties);
    }

    /**
     * Builds a {@link WebClient} with the pipeline's timeouts. Exposed for components that are
     * constructed outside the application context.
     */
    public static WebClient buildWebClient(PipelineProperties properties) {
        PipelineProperties.Download download = properties.getDownload();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, download.getConnectTimeoutMs())
                .responseTimeout(Duration.ofSeconds(download.getResponseTimeoutSeconds()))
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(properties.getManifest().getMaxInMemoryBytes()))
                .build();
    }
}
