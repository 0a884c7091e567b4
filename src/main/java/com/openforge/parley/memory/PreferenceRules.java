package com.openforge.parley.memory;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Fixed tables that turn user text into preference observations.
 *
 * Turn rules run on every recorded user utterance; feedback rules run on
 * explicit feedback and may also look at what the judged answer did.
 * Shared, read-only.
 */
@Component
public class PreferenceRules {

    public record Observation(String category, String key, String value) {}

    private record TurnRule(Pattern pattern, Observation observation) {}

    private record FeedbackRule(Pattern pattern, Predicate<FeedbackContext> when, Observation observation) {}

    static final String STYLE      = "explanation_style";
    static final String DIFFICULTY = "difficulty_level";

    private static final List<TurnRule> TURN_RULES = List.of(
            turn("\\bexamples?\\b|\\bdemonstrate\\b", STYLE, "use_examples", "true"),
            turn("\\bin detail\\b|\\bdetailed\\b|\\bmore detail", STYLE, "detailed", "true"),
            turn("\\bsummari[sz]e|\\bbriefly\\b|\\btl;?dr\\b|\\bin short\\b", STYLE, "concise", "true"),
            turn("\\bstep[ -]by[ -]step\\b", STYLE, "step_by_step", "true"),
            turn("\\btoo easy\\b", DIFFICULTY, "level", "hard"),
            turn("\\btoo (?:hard|difficult)\\b", DIFFICULTY, "level", "easy"));

    private static final List<FeedbackRule> FEEDBACK_RULES = List.of(
            feedback("\\b(?:good|great|perfect|helpful|clear)\\b", FeedbackContext::usedExamples,
                    STYLE, "use_examples", "true"),
            feedback("\\b(?:confusing|unclear|complicated|too much)\\b", FeedbackContext::detailedExplanation,
                    STYLE, "concise", "true"),
            feedback("\\b(?:more|show) examples\\b", c -> true, STYLE, "use_examples", "true"),
            feedback("\\b(?:simpler|easier)\\b", c -> true, STYLE, "simplify", "true"),
            feedback("\\b(?:more detail|too short|elaborate)\\b", c -> true, STYLE, "detailed", "true"),
            feedback("\\b(?:too long|shorter|too verbose)\\b", c -> true, STYLE, "concise", "true"),
            feedback("\\bstep[ -]by[ -]step\\b", c -> true, STYLE, "step_by_step", "true"),
            feedback("\\btoo easy\\b", c -> true, DIFFICULTY, "level", "hard"),
            feedback("\\btoo (?:hard|difficult)\\b", c -> true, DIFFICULTY, "level", "easy"));

    public List<Observation> observe(String utterance) {
        if (utterance == null || utterance.isBlank()) return List.of();
        String text = utterance.toLowerCase(Locale.ROOT);
        List<Observation> out = new ArrayList<>();
        for (TurnRule rule : TURN_RULES) {
            if (rule.pattern().matcher(text).find()) out.add(rule.observation());
        }
        return out;
    }

    /** Empty when the feedback maps to no rule. */
    public List<Observation> fromFeedback(String feedback, FeedbackContext context) {
        if (feedback == null || feedback.isBlank()) return List.of();
        String text = feedback.toLowerCase(Locale.ROOT);
        FeedbackContext ctx = context == null ? FeedbackContext.none() : context;
        List<Observation> out = new ArrayList<>();
        for (FeedbackRule rule : FEEDBACK_RULES) {
            if (rule.pattern().matcher(text).find() && rule.when().test(ctx) && !out.contains(rule.observation())) {
                out.add(rule.observation());
            }
        }
        return out;
    }

    private static TurnRule turn(String regex, String category, String key, String value) {
        return new TurnRule(Pattern.compile(regex), new Observation(category, key, value));
    }

    private static FeedbackRule feedback(String regex, Predicate<FeedbackContext> when,
                                         String category, String key, String value) {
        return new FeedbackRule(Pattern.compile(regex), when, new Observation(category, key, value));
    }
}
