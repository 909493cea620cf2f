package com.eyelevel.tdocpipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * LibreOffice settings under "app.jodconverter", used to render Word, PowerPoint and Excel TDocs.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.jodconverter")
public class OfficeProperties {

    /**
     * Starts the office processes. Without them only PDFs can be converted.
     */
    private boolean enabled = false;

    @Valid
    @NotNull
    private Office office = new Office();

    @Data
    public static class Office {
        @NotBlank
        private String home = "/usr/lib/libreoffice";
        /**
         * One office process per port; the number of ports bounds parallel Office renders.
         */
        @NotEmpty
        private List<Integer> portNumbers = new ArrayList<>(List.of(2002));
        /**
         * Longest a single document may take to render, in milliseconds.
         */
        @Min(1)
        private long taskExecutionTimeout = 120_000;
        /**
         * Documents rendered by one process before it is restarted.
         */
        @Min(1)
        private int maxTasksPerProcess = 200;

        public int[] portNumberArray() {
            return portNumbers.stream().mapToInt(Integer::intValue).toArray();
        }
    }
}
