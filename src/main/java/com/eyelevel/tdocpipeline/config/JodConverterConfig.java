package com.eyelevel.tdocpipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.jodconverter.local.office.LocalOfficeManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures and manages the lifecycle of a local LibreOffice instance used to render Office
 * documents. The office process is only started when {@code app.jodconverter.enabled=true};
 * without it, Office documents fail conversion with an explicit reason and PDFs still render.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "app.jodconverter", name = "enabled", havingValue = "true")
public class JodConverterConfig {

    /**
     * The office manager behind {@code OfficeDocumentRenderer}. Spring starts the office
     * processes with the context and stops them on shutdown, so a run never leaves
     * LibreOffice behind.
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    public LocalOfficeManager officeManager(OfficeProperties properties) {
        OfficeProperties.Office office = properties.getOffice();
        log.info("Starting LibreOffice from {} on port(s) {}. Render timeout: {} ms",
                office.getHome(), office.getPortNumbers(), office.getTaskExecutionTimeout());
        return LocalOfficeManager.builder()
                                 .officeHome(office.getHome())
                                 .portNumbers(office.portNumberArray())
                                 .taskExecutionTimeout(office.getTaskExecutionTimeout())
                                 .maxTasksPerProcess(office.getMaxTasksPerProcess())
                                 .build();
    }
}
