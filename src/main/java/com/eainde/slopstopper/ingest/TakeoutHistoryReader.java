package com.eainde.slopstopper.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a Google Takeout {@code watch-history.json} export.
 * <pre>
 * [
 *   {
 *     "header": "YouTube",
 *     "title": "Watched Some Video",
 *     "titleUrl": "https://www.youtube.com/watch?v=dQw4w9WgXcQ",
 *     "subtitles": [ { "name": "Channel", "url": "https://www.youtube.com/channel/UC..." } ],
 *     "time": "2024-03-01T18:22:41.123Z"
 *   }
 * ]
 * </pre>
 */
@Slf4j
public class TakeoutHistoryReader {

    private static final String WATCHED_PREFIX = "Watched ";

    private final ObjectMapper objectMapper;

    public TakeoutHistoryReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<HistoryEntry> read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read watch history from " + file, e);
        }
    }

    public List<HistoryEntry> read(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null || !root.isArray()) {
            throw new IOException("Watch history must be a JSON array");
        }
        List<HistoryEntry> entries = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            entries.add(toEntry(node));
        }
        log.info("Read {} watch-history entries", entries.size());
        return entries;
    }

    private HistoryEntry toEntry(JsonNode node) {
        String title = text(node, "title");
        if (title != null && title.startsWith(WATCHED_PREFIX)) {
            title = title.substring(WATCHED_PREFIX.length());
        }

        String channelName = null;
        String channelUrl = null;
        JsonNode subtitles = node.path("subtitles");
        if (subtitles.isArray() && !subtitles.isEmpty()) {
            channelName = text(subtitles.get(0), "name");
            channelUrl = text(subtitles.get(0), "url");
        }

        String rawTime = text(node, "time");
        return new HistoryEntry(text(node, "header"), title, text(node, "titleUrl"),
                channelName, channelUrl, parseTime(rawTime), rawTime);
    }

    private static Instant parseTime(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            log.debug("Unparsable watch time '{}'", raw);
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
