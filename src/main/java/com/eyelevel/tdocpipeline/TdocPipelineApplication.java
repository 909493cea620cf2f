package com.eyelevel.tdocpipeline;

import com.eyelevel.tdocpipeline.config.OfficeProperties;
import com.eyelevel.tdocpipeline.config.PipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;

/**
 * The main entry point for the TDoc pipeline.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds "app.pipeline" to {@link PipelineProperties}
 *     and "app.jodconverter" to {@link OfficeProperties}.</li>
 *     <li>{@link EnableRetry}: activates the retry of transient download failures.</li>
 * </ul>
 * The pipeline itself is started by the {@code PipelineRunner} once the context is ready.
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = {PipelineProperties.class, OfficeProperties.class})
@EnableRetry
public class TdocPipelineApplication {

    /**
     * Launches the application and exits once the pipeline run has finished.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting TdocPipelineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(TdocPipelineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' has completed.", env.getProperty("spring.application.name", "tdoc-pipeline"));
        log.info("  - Storage root: {}", env.getProperty("app.pipeline.root-dir", "artifacts"));
        log.info("  - Profile(s):   {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
        System.exit(SpringApplication.exit(context));
    }
}
