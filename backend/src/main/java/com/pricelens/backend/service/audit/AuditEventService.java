package com.pricelens.backend.service.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricelens.backend.config.ExplainabilityProperties;
import com.pricelens.backend.model.AuditEvent;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends every audit event as one JSON line to the configured file and echoes it to the log.
 */
@Service
@Slf4j
public class AuditEventService implements AuditSink {

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean fileEnabled;
    private final Path logFile;

    public AuditEventService(ObjectMapper objectMapper, ExplainabilityProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.fileEnabled = properties.getAudit().isFileEnabled();
        this.logFile = Path.of(properties.getAudit().getLogFile());
    }

    @Override
    public void logEvent(String eventType, Map<String, Object> details) {
        try {
            AuditEvent event = AuditEvent.builder()
                    .timestamp(Instant.now(clock))
                    .eventType(eventType)
                    .correlationId(MDC.get(CORRELATION_ID))
                    .details(details == null ? Map.of() : new LinkedHashMap<>(details))
                    .build();
            if (fileEnabled) {
                append(objectMapper.writeValueAsString(event));
            }
            log.info("Logged audit event: {}", eventType);
        } catch (Exception e) {
            log.warn("Failed to record audit event {} - {}", eventType, e.getMessage());
        }
    }

    private synchronized void append(String line) throws IOException {
        Path parent = logFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(logFile, line + System.lineSeparator(), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
