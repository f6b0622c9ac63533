package com.yoursp.vkyc.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Binds the {@code external.*} YAML properties: OCR and registry endpoints.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "external")
public class ExternalServiceProperties {

    private Ocr ocr = new Ocr();
    private Registry registry = new Registry();

    @Getter
    @Setter
    public static class Ocr {
        private String baseUrl = "http://localhost:8001/api/ocr";
        private Duration timeout = Duration.ofSeconds(30);

        /** Convenience: per-document OCR endpoint */
        public String endpointFor(String documentCode) {
            return baseUrl + "/" + documentCode;
        }
    }

    @Getter
    @Setter
    public static class Registry {
        private String url = "http://localhost:8002/api/digilocker/verify";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(10);
    }
}
