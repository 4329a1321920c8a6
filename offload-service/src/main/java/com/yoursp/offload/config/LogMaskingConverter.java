package com.yoursp.offload.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks credentials in log messages.
 * <ul>
 * <li>Compact JWTs: header + "...[JWT]"</li>
 * <li>Bearer tokens: first 8 chars + "..."</li>
 * <li>secret / password values: "[REDACTED]"</li>
 * <li>bcrypt and worker-salt password hashes: "[HASH]"</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml as {@code %mask(...)}.
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // header.payload.signature, base64url segments
    private static final Pattern JWT_PATTERN = Pattern
            .compile("(eyJ[A-Za-z0-9_-]{4})[A-Za-z0-9_-]*\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+");

    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // secret=<value>, "password":"<value>", clientSecret: <value>
    private static final Pattern CREDENTIAL_PATTERN = Pattern
            .compile("(?i)((?:secret|password)[\"']?\\s*[=:]\\s*[\"']?)[^\"'&\\s,}]+");

    private static final Pattern PASSWORD_HASH_PATTERN = Pattern
            .compile("(\\$2[aby]\\$\\d{2}\\$[./A-Za-z0-9]{53})|(ws\\$[^$\\s]+\\$[0-9a-fA-F]{64})");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = JWT_PATTERN.matcher(masked).replaceAll("$1...[JWT]");
        masked = CREDENTIAL_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = PASSWORD_HASH_PATTERN.matcher(masked).replaceAll("[HASH]");

        return masked;
    }
}
