package com.example.minimap_backend.service.notification;

import com.example.minimap_backend.config.NotificationProperties;
import com.example.minimap_backend.model.Participant;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the Discord webhook payload that summarizes a finished render from its participant list.
 */
@Component
public class RenderSummaryFormatter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderSummaryFormatter.class);

    static final String TITLE = "Render Complete";
    static final int COLOR = 0x57F287;
    static final String SUBJECT_FIELD = "Player In Render";
    static final String OTHERS_FIELD = "Other Players";
    static final String NO_INFO = "No player info available.";
    static final String FORMAT_ERROR = "Error formatting player info.";
    static final String TRUNCATION_MARKER = "...";
    private static final String UNKNOWN = "Unknown";

    private static final TypeReference<List<Participant>> PARTICIPANTS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Set<Integer> reservedRelations;
    private final int otherPlayersByteLimit;

    public RenderSummaryFormatter(ObjectMapper objectMapper, NotificationProperties properties) {
        this.objectMapper = objectMapper;
        this.reservedRelations = Set.copyOf(properties.getReservedRelations());
        this.otherPlayersByteLimit = properties.getOtherPlayersByteLimit();
    }

    /** Reads the metadata artifact; a missing file yields the no-info payload. */
    public Map<String, Object> fromMetadata(Path metadataPath) {
        if (metadataPath == null || !Files.isRegularFile(metadataPath)) {
            return Map.of("content", NO_INFO);
        }
        try {
            List<Participant> participants = objectMapper.readValue(metadataPath.toFile(), PARTICIPANTS);
            return format(participants);
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Unreadable render metadata path={} err={}", metadataPath, e.toString());
            return Map.of("content", FORMAT_ERROR);
        }
    }

    public Map<String, Object> format(List<Participant> participants) {
        if (participants == null || participants.isEmpty()) {
            return Map.of("content", NO_INFO);
        }
        List<Participant> subjects = new ArrayList<>();
        List<Participant> others = new ArrayList<>();
        for (Participant p : participants) {
            if (p == null) {
                continue;
            }
            (isReserved(p) ? others : subjects).add(p);
        }

        List<Map<String, Object>> fields = new ArrayList<>();
        String subjectValue = subjects.isEmpty()
                ? UNKNOWN
                : subjects.stream()
                        .map(p -> orUnknown(p.name()) + " (" + (p.ship() == null ? "Unknown Ship" : p.ship()) + ")")
                        .collect(Collectors.joining("\n"));
        fields.add(field(SUBJECT_FIELD, subjectValue));

        if (!others.isEmpty()) {
            String names = others.stream()
                    .map(p -> orUnknown(p.name()))
                    .sorted(Comparator.naturalOrder())
                    .collect(Collectors.joining(", "));
            fields.add(field(OTHERS_FIELD, truncateUtf8(names, otherPlayersByteLimit)));
        }

        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", TITLE);
        embed.put("color", COLOR);
        embed.put("fields", fields);
        return Map.of("embeds", List.of(embed));
    }

    /**
     * Cuts {@code value} so that its UTF-8 encoding, marker included, fits in {@code maxBytes}.
     * Never splits a code point.
     */
    static String truncateUtf8(String value, int maxBytes) {
        if (value.getBytes(StandardCharsets.UTF_8).length <= maxBytes) {
            return value;
        }
        int budget = maxBytes - TRUNCATION_MARKER.length();
        StringBuilder out = new StringBuilder();
        int used = 0;
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            int size = utf8Length(cp);
            if (used + size > budget) {
                break;
            }
            out.appendCodePoint(cp);
            used += size;
            i += Character.charCount(cp);
        }
        return out.append(TRUNCATION_MARKER).toString();
    }

    private static int utf8Length(int codePoint) {
        if (codePoint < 0x80) return 1;
        if (codePoint < 0x800) return 2;
        if (codePoint < 0x10000) return 3;
        return 4;
    }

    private static Map<String, Object> field(String name, String value) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("name", name);
        f.put("value", value);
        f.put("inline", false);
        return f;
    }

    private boolean isReserved(Participant p) {
        return p.relation() != null && reservedRelations.contains(p.relation());
    }

    private static String orUnknown(String name) {
        return name == null || name.isBlank() ? UNKNOWN : name;
    }
}
