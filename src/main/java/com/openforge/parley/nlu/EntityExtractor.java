package com.openforge.parley.nlu;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Typed pattern extraction and slot filling.
 *
 * Algorithm:
 *   1. Every {@link EntityType} with a pattern is run over the text.
 *   2. Overlapping spans: longest wins; equal length goes to the type declared
 *      first in {@link EntityType}.
 *   3. A surviving bare NUMBER is re-read as IDENTIFIER or AMOUNT when a keyword
 *      sits within three tokens of it. Identifier keywords win if both kinds occur.
 *   4. The first surviving span per type is the reported entity.
 *   5. Each slot tries its own patterns, then falls back to an entity of its type.
 *
 * Stateless and thread-safe. Never throws: failures yield empty results.
 */
@Slf4j
@Component
public class EntityExtractor {

    static final int KEYWORD_WINDOW = 3;

    static final Set<String> IDENTIFIER_KEYWORDS = Set.of(
            "pnr", "id", "order", "ticket", "code", "pin", "pincode",
            "account", "train", "number", "no");

    static final Set<String> AMOUNT_KEYWORDS = Set.of(
            "rs", "rupees", "inr", "dollars", "usd", "euros", "price",
            "cost", "amount", "pay", "spend", "worth", "budget");

    private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");

    // ── Public API ───────────────────────────────────────────────────────────

    /** Entities only, no slot schema. */
    public Extraction extract(String text) {
        return extract(text, SlotSchema.EMPTY);
    }

    public Extraction extract(String text, SlotSchema schema) {
        SlotSchema slots = schema == null ? SlotSchema.EMPTY : schema;
        if (text == null || text.isBlank()) {
            return new Extraction(Map.of(), List.of(), unfilled(slots));
        }
        try {
            List<ExtractedEntity> spans = findEntities(text);
            Map<String, ExtractedEntity> firstPerType = new LinkedHashMap<>();
            for (ExtractedEntity e : spans) {
                firstPerType.putIfAbsent(e.type().key(), e);
            }
            return new Extraction(firstPerType, spans, fillSlots(text, slots, firstPerType));
        } catch (RuntimeException e) {
            log.warn("[Extractor] Extraction failed for '{}': {}", abbreviate(text), e.toString());
            return new Extraction(Map.of(), List.of(), unfilled(slots));
        }
    }

    // ── Entities ─────────────────────────────────────────────────────────────

    List<ExtractedEntity> findEntities(String text) {
        List<ExtractedEntity> candidates = new ArrayList<>();
        for (EntityType type : EntityType.values()) {
            Pattern pattern = type.pattern();
            if (pattern == null) continue;
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                int group = m.groupCount() >= 1 && m.group(1) != null ? 1 : 0;
                if (m.end(group) > m.start(group)) {
                    candidates.add(new ExtractedEntity(type, m.group(group).trim(), m.start(group), m.end(group)));
                }
            }
        }

        candidates.sort(Comparator
                .comparingInt(ExtractedEntity::length).reversed()
                .thenComparing(ExtractedEntity::type)
                .thenComparingInt(ExtractedEntity::start));

        List<ExtractedEntity> accepted = new ArrayList<>();
        for (ExtractedEntity candidate : candidates) {
            if (accepted.stream().noneMatch(candidate::overlaps)) {
                accepted.add(candidate);
            }
        }
        accepted.sort(Comparator.comparingInt(ExtractedEntity::start));

        List<Token> tokens = tokenize(text);
        List<ExtractedEntity> result = new ArrayList<>(accepted.size());
        for (ExtractedEntity e : accepted) {
            result.add(e.type() == EntityType.NUMBER ? disambiguate(e, tokens) : e);
        }
        return result;
    }

    private ExtractedEntity disambiguate(ExtractedEntity number, List<Token> tokens) {
        int first = -1, last = -1;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.start < number.end() && number.start() < t.end) {
                if (first < 0) first = i;
                last = i;
            }
        }
        if (first < 0) return number;

        boolean identifier = false, amount = false;
        int from = Math.max(0, first - KEYWORD_WINDOW);
        int to   = Math.min(tokens.size() - 1, last + KEYWORD_WINDOW);
        for (int i = from; i <= to; i++) {
            if (i >= first && i <= last) continue;
            String word = tokens.get(i).text;
            identifier |= IDENTIFIER_KEYWORDS.contains(word);
            amount     |= AMOUNT_KEYWORDS.contains(word);
        }
        if (identifier) return number.withType(EntityType.IDENTIFIER);
        if (amount)     return number.withType(EntityType.AMOUNT);
        return number;
    }

    // ── Slots ────────────────────────────────────────────────────────────────

    private Map<String, SlotValue> fillSlots(String text,
                                             SlotSchema schema,
                                             Map<String, ExtractedEntity> entities) {
        Map<String, SlotValue> slots = new LinkedHashMap<>();
        for (SlotSpec spec : schema.slots()) {
            String value = fromPatterns(text, spec);
            if (value == null) {
                value = fromEntities(spec.type(), entities);
            }
            slots.put(spec.name(), value == null ? SlotValue.unfilled(spec) : SlotValue.filled(spec, value));
        }
        return slots;
    }

    private static String fromPatterns(String text, SlotSpec spec) {
        for (Pattern pattern : spec.patterns()) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                String value = m.groupCount() >= 1 && m.group(1) != null ? m.group(1) : m.group();
                if (!value.isBlank()) {
                    return value.trim();
                }
            }
        }
        return null;
    }

    private static String fromEntities(EntityType type, Map<String, ExtractedEntity> entities) {
        if (type == null) return null;
        ExtractedEntity e = entities.get(type.key());
        if (e == null && type == EntityType.NUMBER) {
            // a number re-read as identifier or amount still satisfies a numeric slot
            e = entities.getOrDefault(EntityType.IDENTIFIER.key(), entities.get(EntityType.AMOUNT.key()));
        }
        return e == null ? null : e.value();
    }

    private static Map<String, SlotValue> unfilled(SlotSchema schema) {
        Map<String, SlotValue> slots = new LinkedHashMap<>();
        for (SlotSpec spec : schema.slots()) {
            slots.put(spec.name(), SlotValue.unfilled(spec));
        }
        return slots;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private record Token(String text, int start, int end) {}

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(text);
        while (m.find()) {
            tokens.add(new Token(m.group().toLowerCase(Locale.ROOT), m.start(), m.end()));
        }
        return tokens;
    }

    static String abbreviate(String text) {
        return text.length() <= 60 ? text : text.substring(0, 60) + "...";
    }
}
