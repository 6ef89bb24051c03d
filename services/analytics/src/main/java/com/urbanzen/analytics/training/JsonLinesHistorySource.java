package com.urbanzen.analytics.training;

import com.urbanzen.analytics.exception.AnalyticsException;
import com.urbanzen.analytics.exception.MalformedEventException;
import com.urbanzen.analytics.ingest.TelemetryEventDecoder;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads exported telemetry from a file holding one JSON event per line.
 * Blank lines are ignored and undecodable lines are skipped.
 */
@Slf4j
public class JsonLinesHistorySource implements TelemetryHistorySource {

    private final Path file;
    private final TelemetryEventDecoder decoder;

    public JsonLinesHistorySource(Path file, TelemetryEventDecoder decoder) {
        this.file = file;
        this.decoder = decoder;
    }

    @Override
    public List<TelemetryEvent> fetchHistory(Instant since) {
        if (!Files.exists(file)) {
            log.warn("Telemetry history file {} does not exist", file);
            return List.of();
        }

        List<TelemetryEvent> events = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    TelemetryEvent event = decoder.decode(line);
                    if (event.timestamp() != null && !event.timestamp().isBefore(since)) {
                        events.add(event);
                    }
                } catch (MalformedEventException e) {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new AnalyticsException("Failed to read telemetry history from " + file, e);
        }

        if (skipped > 0) {
            log.warn("Skipped {} undecodable lines in {}", skipped, file);
        }
        log.info("Read {} historical events since {} from {}", events.size(), since, file);
        return events;
    }
}
