package com.yoursp.vkyc.config;

import com.yoursp.vkyc.model.enums.DocumentType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Binds the {@code vkyc.*} YAML properties into a typed bean.
 * <p>
 * Thresholds, retry counts and timers are operational parameters: tune them per
 * environment rather than in code.
 * </p>
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "vkyc")
public class VkycProperties {

    /** Public frontend URL used to build resolvable links. */
    private String frontendBaseUrl = "http://localhost:4200";

    private Link link = new Link();
    private Verification verification = new Verification();
    private Signaling signaling = new Signaling();
    private Biometric biometric = new Biometric();
    private Recording recording = new Recording();

    @Getter
    @Setter
    public static class Link {
        /** Lifetime of a freshly issued link. */
        private Duration ttl = Duration.ofHours(24);
        /** How long a scheduled-occurrence link stays valid after its slot. */
        private Duration scheduledValidity = Duration.ofHours(1);
        /** Furthest a session may be scheduled into the future. */
        private Duration schedulingHorizon = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Verification {
        private double ocrConfidenceThreshold = 0.6;
        private int ocrMaxAttempts = 3;
        /** Total registry calls per frame, first call included. */
        private int registryMaxAttempts = 2;
        private Duration registryInitialBackoff = Duration.ofMillis(500);
        private double registryBackoffMultiplier = 2.0;
        private Set<DocumentType> requiredDocuments = EnumSet.of(DocumentType.PAN, DocumentType.AADHAAR);
    }

    @Getter
    @Setter
    public static class Signaling {
        private Duration disconnectGracePeriod = Duration.ofSeconds(30);
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration heartbeatTimeout = Duration.ofSeconds(60);
        private int maxMessageBytes = 4 * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class Biometric {
        private int bufferCapacity = 1000;
        private int minBlinks = 1;
    }

    @Getter
    @Setter
    public static class Recording {
        private Duration maxDuration = Duration.ofMinutes(10);
        private String spoolDirectory = "/tmp/vkyc-spool";
        /** {@code gzip} or {@code passthrough}. */
        private String codec = "gzip";
    }
}
