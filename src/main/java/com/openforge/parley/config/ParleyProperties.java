package com.openforge.parley.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunable thresholds of the understanding-and-memory core.
 *
 * application.yml:
 *
 * parley:
 *   classifier:
 *     pattern-confidence: 0.9
 *     semantic-trigger: 0.6
 *     context-boost: 0.1
 *     confidence-floor: 0.3
 *   memory:
 *     short-term-capacity: 3
 *     promotion-threshold: 3
 *     session-timeout: 30m
 *   router:
 *     clarification-threshold: 0.6
 *
 * The defaults are empirical starting points, not derived values.
 * {@link #defaults()} mirrors them for code that runs outside Spring.
 */
@Validated
@ConfigurationProperties(prefix = "parley")
public record ParleyProperties(
        @Valid @DefaultValue ClassifierProperties classifier,
        @Valid @DefaultValue MemoryProperties memory,
        @Valid @DefaultValue RouterProperties router
) {

    public static ParleyProperties defaults() {
        return new ParleyProperties(
                ClassifierProperties.defaults(),
                MemoryProperties.defaults(),
                RouterProperties.defaults());
    }

    /**
     * @param patternConfidence        confidence of a full structural pattern match
     * @param partialPatternConfidence confidence of a pattern found inside the utterance
     * @param slotConfidence           confidence of a category implied only by extracted entities
     * @param semanticTrigger          below this, the semantic stage runs
     * @param semanticThreshold        minimum similarity for a semantic match to count
     * @param contextBoost             added when the previous turn had the same category
     * @param confidenceFloor          below this, the result is {@code UNKNOWN}
     * @param missingSlotPenalty       multiplier applied once per unfilled required slot
     * @param ambiguityEpsilon         candidates closer than this are logged as ambiguous
     */
    public record ClassifierProperties(
            @DefaultValue("0.9")  @DecimalMin("0.0") @DecimalMax("1.0") double patternConfidence,
            @DefaultValue("0.7")  @DecimalMin("0.0") @DecimalMax("1.0") double partialPatternConfidence,
            @DefaultValue("0.65") @DecimalMin("0.0") @DecimalMax("1.0") double slotConfidence,
            @DefaultValue("0.6")  @DecimalMin("0.0") @DecimalMax("1.0") double semanticTrigger,
            @DefaultValue("0.5")  @DecimalMin("0.0") @DecimalMax("1.0") double semanticThreshold,
            @DefaultValue("0.1")  @DecimalMin("0.0") @DecimalMax("1.0") double contextBoost,
            @DefaultValue("0.3")  @DecimalMin("0.0") @DecimalMax("1.0") double confidenceFloor,
            @DefaultValue("0.9")  @DecimalMin("0.0") @DecimalMax("1.0") double missingSlotPenalty,
            @DefaultValue("0.05") @DecimalMin("0.0") @DecimalMax("1.0") double ambiguityEpsilon
    ) {
        public static ClassifierProperties defaults() {
            return new ClassifierProperties(0.9, 0.7, 0.65, 0.6, 0.5, 0.1, 0.3, 0.9, 0.05);
        }
    }

    /**
     * @param shortTermCapacity  turns kept in the per-session buffer
     * @param promotionThreshold observations before a preference becomes active
     * @param relevantTopK       long-term entries surfaced in the adaptive context
     * @param minRelevance       long-term hits scoring below this are dropped
     * @param sessionTimeout     idle time after which a session is expired
     */
    public record MemoryProperties(
            @DefaultValue("3")   @Min(1) int shortTermCapacity,
            @DefaultValue("3")   @Min(1) int promotionThreshold,
            @DefaultValue("3")   @Min(0) int relevantTopK,
            @DefaultValue("0.2") @DecimalMin("0.0") @DecimalMax("1.0") double minRelevance,
            @DefaultValue("30m") Duration sessionTimeout
    ) {
        public static MemoryProperties defaults() {
            return new MemoryProperties(3, 3, 3, 0.2, Duration.ofMinutes(30));
        }
    }

    public record RouterProperties(
            @DefaultValue("0.6") @DecimalMin("0.0") @DecimalMax("1.0") double clarificationThreshold
    ) {
        public static RouterProperties defaults() {
            return new RouterProperties(0.6);
        }
    }
}
