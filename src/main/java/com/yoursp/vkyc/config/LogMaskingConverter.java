package com.yoursp.vkyc.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks sensitive data in log messages.
 * <ul>
 * <li>Bearer tokens: first 8 chars + "..."</li>
 * <li>Link tokens ({@code token=...}, {@code /vkyc/<token>}): first 6 chars +
 * "..."</li>
 * <li>PAN numbers: "PAN:[REDACTED]"</li>
 * <li>Aadhaar numbers: last 4 digits only (XXXX-XXXX-1234)</li>
 * <li>Mobile numbers: last 4 digits only (***1234)</li>
 * </ul>
 * <p>
 * Register in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.vkyc.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches Bearer tokens: "Bearer <token>"
    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // Matches token=<value> or "token":"<value>"
    private static final Pattern LINK_TOKEN_PATTERN = Pattern
            .compile("(token[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-]{6})[A-Za-z0-9_\\-]+");

    // Matches link URLs: /vkyc/<token>
    private static final Pattern LINK_URL_PATTERN = Pattern
            .compile("(/vkyc/)([A-Za-z0-9_\\-]{6})[A-Za-z0-9_\\-]{10,}");

    // Matches PAN numbers (ABCDE1234F)
    private static final Pattern PAN_PATTERN = Pattern.compile("\\b[A-Z]{5}\\d{4}[A-Z]\\b");

    // Matches Aadhaar numbers: 12 digits, optionally grouped 4-4-4
    private static final Pattern AADHAAR_PATTERN = Pattern.compile("\\b\\d{4}[ -]?\\d{4}[ -]?(\\d{4})\\b");

    // Matches mobile numbers starting with + followed by digits
    private static final Pattern MOBILE_PATTERN = Pattern.compile("(\\+\\d{1,4})(\\d+)(\\d{4})");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = LINK_TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = LINK_URL_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = MOBILE_PATTERN.matcher(masked).replaceAll("***$3");
        masked = PAN_PATTERN.matcher(masked).replaceAll("PAN:[REDACTED]");
        masked = AADHAAR_PATTERN.matcher(masked).replaceAll("XXXX-XXXX-$1");

        return masked;
    }
}
