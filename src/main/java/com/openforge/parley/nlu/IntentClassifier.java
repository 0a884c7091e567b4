package com.openforge.parley.nlu;

import com.openforge.parley.config.ParleyProperties.ClassifierProperties;
import com.openforge.parley.semantic.LabelMatch;
import com.openforge.parley.semantic.SemanticMatcher;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Staged intent classification.
 *
 * Stages, with early exit:
 *
 *   1. Pattern     {@link IntentPatternBank} in declared order.
 *                   Full match → patternConfidence, partial → partialPatternConfidence,
 *                   each multiplied by missingSlotPenalty per unfilled required slot.
 *   2. Slot        entities that imply a category (CLI command, arithmetic, URL)
 *                   propose it at slotConfidence.
 *   3. Semantic    only when the best so far is below semanticTrigger: nearest
 *                   labelled example in {@link ExampleBank}, kept if ≥ semanticThreshold.
 *   4. Context     +contextBoost when the previous turn had the winning category.
 *   5. Fallback    below confidenceFloor the result is {@link Intent#unknown()}.
 *
 * Equal confidence prefers the earlier stage, then the earlier declaration.
 * Stateless: one instance serves every session.
 */
@Slf4j
public class IntentClassifier {

    private static final Pattern ARITHMETIC =
            Pattern.compile("\\d+(?:\\.\\d+)?\\s*(?:[-+*/×÷^]|\\b(?:plus|minus|times|divided by)\\b)\\s*\\d+(?:\\.\\d+)?");

    private static final Comparator<Candidate> RANKING = Comparator
            .comparingDouble(Candidate::confidence).reversed()
            .thenComparing(Candidate::source)
            .thenComparingInt(Candidate::order);

    private final EntityExtractor      extractor;
    private final SemanticMatcher      matcher;
    private final IntentPatternBank    patterns;
    private final ExampleBank          examples;
    private final ClassifierProperties properties;

    public IntentClassifier(EntityExtractor extractor,
                            SemanticMatcher matcher,
                            IntentPatternBank patterns,
                            ExampleBank examples,
                            ClassifierProperties properties) {
        this.extractor  = extractor;
        this.matcher    = matcher;
        this.patterns   = patterns;
        this.examples   = examples;
        this.properties = properties;
    }

    private record Candidate(IntentCategory category,
                             double confidence,
                             IntentSource source,
                             int order,
                             IntentPattern pattern) {}

    // ── Public API ───────────────────────────────────────────────────────────

    /** Never null, never throws. */
    public Intent classify(String text, ClassificationContext context) {
        if (text == null || text.isBlank()) {
            return Intent.unknown();
        }
        ClassificationContext ctx = context == null ? ClassificationContext.empty() : context;
        try {
            return doClassify(text, ctx);
        } catch (RuntimeException e) {
            log.error("[Classifier] Classification failed for '{}', falling back to UNKNOWN",
                    EntityExtractor.abbreviate(text), e);
            return Intent.unknown();
        }
    }

    public Intent classify(String text) {
        return classify(text, ClassificationContext.empty());
    }

    // ── Stages ───────────────────────────────────────────────────────────────

    private Intent doClassify(String text, ClassificationContext ctx) {
        String normalized = normalize(text);
        List<Candidate> candidates = new ArrayList<>();

        patternStage(text, normalized, candidates);
        slotStage(text, candidates);

        Optional<Candidate> best = candidates.stream().min(RANKING);
        if (best.isEmpty() || best.get().confidence() < properties.semanticTrigger()) {
            semanticStage(normalized, candidates);
            best = candidates.stream().min(RANKING);
        }
        if (best.isEmpty()) {
            log.debug("[Classifier] No candidate for '{}'", EntityExtractor.abbreviate(text));
            return Intent.unknown();
        }
        logAmbiguity(text, candidates, best.get());

        Candidate winner = best.get();
        double confidence = winner.confidence();
        if (ctx.continues(winner.category())) {
            confidence = Math.min(1.0, confidence + properties.contextBoost());
        }
        if (confidence < properties.confidenceFloor()) {
            log.debug("[Classifier] '{}' best={} {} below floor, UNKNOWN",
                    EntityExtractor.abbreviate(text), winner.category(), String.format("%.2f", confidence));
            return Intent.unknown();
        }

        SlotSchema schema = winner.pattern() == null ? SlotSchema.EMPTY : winner.pattern().schema();
        Extraction extraction = extractor.extract(text, schema);
        log.debug("[Classifier] '{}' → {} ({}, {})", EntityExtractor.abbreviate(text),
                winner.category(), winner.source(), String.format("%.2f", confidence));
        return new Intent(winner.category(), confidence, extraction.entities(), extraction.slots(), winner.source());
    }

    private void patternStage(String text, String normalized, List<Candidate> out) {
        for (IntentPattern pattern : patterns.patterns()) {
            IntentPattern.MatchKind kind = pattern.match(normalized);
            if (kind == IntentPattern.MatchKind.NONE) continue;

            double base = kind == IntentPattern.MatchKind.FULL
                    ? properties.patternConfidence()
                    : properties.partialPatternConfidence();
            double penalty = pattern.schema().isEmpty()
                    ? 1.0
                    : extractor.extract(text, pattern.schema()).penalty(properties.missingSlotPenalty());
            out.add(new Candidate(pattern.category(), base * penalty, IntentSource.PATTERN, out.size(), pattern));
        }
    }

    private void slotStage(String text, List<Candidate> out) {
        Extraction extraction = extractor.extract(text);
        if (extraction.has(EntityType.CLI_COMMAND)) {
            out.add(slotCandidate(IntentCategory.COMMAND, out.size()));
        }
        if (ARITHMETIC.matcher(text).find()) {
            out.add(slotCandidate(IntentCategory.MATH, out.size()));
        }
        if (extraction.has(EntityType.URL)) {
            out.add(slotCandidate(IntentCategory.FETCH, out.size()));
        }
    }

    private Candidate slotCandidate(IntentCategory category, int order) {
        return new Candidate(category, properties.slotConfidence(), IntentSource.SLOT, order, null);
    }

    private void semanticStage(String normalized, List<Candidate> out) {
        Optional<LabelMatch<IntentCategory>> match =
                matcher.bestLabel(normalized, examples.examples(), properties.semanticThreshold());
        if (match.isPresent()) {
            LabelMatch<IntentCategory> m = match.get();
            out.add(new Candidate(m.label(), m.score(), IntentSource.SEMANTIC, out.size(), null));
        } else if (matcher.isDegraded()) {
            log.debug("[Classifier] Semantic stage skipped, embeddings degraded");
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private void logAmbiguity(String text, List<Candidate> candidates, Candidate best) {
        if (!log.isDebugEnabled()) return;
        candidates.stream()
                .filter(c -> c.category() != best.category())
                .filter(c -> best.confidence() - c.confidence() <= properties.ambiguityEpsilon())
                .min(RANKING)
                .ifPresent(rival -> log.debug(
                        "[Classifier] ClassificationAmbiguous '{}': {} {} vs {} {}, kept {}",
                        EntityExtractor.abbreviate(text),
                        best.category(), String.format("%.2f", best.confidence()),
                        rival.category(), String.format("%.2f", rival.confidence()),
                        best.category()));
    }

    static String normalize(String text) {
        return text.trim()
                .replaceAll("\\s+", " ")
                .replaceAll("[.!?]+$", "")
                .trim()
                .toLowerCase(Locale.ROOT);
    }
}
