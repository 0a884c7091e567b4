package com.openforge.parley.nlu;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexicon-based mood detection.
 *
 * Score per mood: +1 for every keyword contained in the text, +2 for every
 * phrase pattern found. The best-scoring mood wins, earlier moods on ties;
 * no hit at all means NEUTRAL. Confidence is {@code min(score / 5, 1)}.
 *
 * Pure function of its input.
 */
@Component
public class SentimentAnalyzer {

    private static final double MAX_INTENSITY = 3.0;

    private record Lexicon(List<String> keywords, List<Pattern> phrases) {
        static Lexicon of(List<String> keywords, String... phrases) {
            List<Pattern> compiled = new ArrayList<>();
            for (String p : phrases) {
                compiled.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));
            }
            return new Lexicon(keywords, compiled);
        }
    }

    private static final Map<Mood, Lexicon> LEXICONS = new EnumMap<>(Mood.class);

    /** Multiplicative intensifiers, applied before the additive punctuation boosts. */
    private static final Map<Pattern, Double> INTENSIFIERS = new LinkedHashMap<>();

    static {
        LEXICONS.put(Mood.FRUSTRATED, Lexicon.of(
                List.of("confused", "stuck", "help", "don't understand", "frustrated", "difficult",
                        "hard", "impossible", "can't", "struggling", "lost", "unclear", "complicated",
                        "overwhelmed"),
                "i don'?t (get|understand)",
                "this (is|seems) (too )?(hard|difficult|confusing)",
                "(help|stuck|lost)",
                "why (isn'?t|doesn'?t) (this|it) work"));
        LEXICONS.put(Mood.CONFIDENT, Lexicon.of(
                List.of("got it", "understand", "makes sense", "clear", "easy", "simple", "obvious",
                        "straightforward", "perfect", "excellent"),
                "(got|get) it",
                "makes sense",
                "(i )?understand",
                "that'?s (clear|easy|simple)"));
        LEXICONS.put(Mood.EXCITED, Lexicon.of(
                List.of("awesome", "cool", "amazing", "love", "excited", "great", "fantastic",
                        "wonderful", "brilliant", "perfect", "wow"),
                "(that'?s|this is) (awesome|cool|amazing|great)",
                "i love (this|it)",
                "(wow|amazing|fantastic)"));
        LEXICONS.put(Mood.CURIOUS, Lexicon.of(
                List.of("what if", "how about", "could", "would", "interesting", "wonder", "curious",
                        "explore", "learn more"),
                "what if",
                "how about",
                "(could|would) (i|we|you)",
                "(tell|show) me more"));
        LEXICONS.put(Mood.BORED, Lexicon.of(
                List.of("boring", "tedious", "repetitive", "again", "already know", "too easy",
                        "simple", "basic"),
                "(too|so) (easy|simple|basic)",
                "already know",
                "(boring|tedious)"));

        INTENSIFIERS.put(Pattern.compile("\\bvery\\b"), 1.5);
        INTENSIFIERS.put(Pattern.compile("\\breally\\b"), 1.5);
        INTENSIFIERS.put(Pattern.compile("\\bextremely\\b"), 2.0);
        INTENSIFIERS.put(Pattern.compile("\\bso\\b"), 1.3);
        INTENSIFIERS.put(Pattern.compile("\\btotally\\b"), 1.5);
    }

    /** Tone a responder should adopt for {@code mood}. */
    public static String toneFor(Mood mood) {
        return (mood == null ? Mood.NEUTRAL : mood).tone();
    }

    public Sentiment analyze(String text) {
        if (text == null || text.isBlank()) {
            return Sentiment.neutral();
        }
        String lower = text.toLowerCase(Locale.ROOT);

        Mood best = Mood.NEUTRAL;
        int bestScore = 0;
        for (Map.Entry<Mood, Lexicon> entry : LEXICONS.entrySet()) {
            int score = score(lower, entry.getValue());
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }
        double confidence = Math.min(bestScore / 5.0, 1.0);
        return new Sentiment(best, intensity(text, lower), indicators(text), confidence);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static int score(String lower, Lexicon lexicon) {
        int score = 0;
        for (String keyword : lexicon.keywords()) {
            if (lower.contains(keyword)) score += 1;
        }
        for (Pattern phrase : lexicon.phrases()) {
            if (phrase.matcher(lower).find()) score += 2;
        }
        return score;
    }

    private static double intensity(String original, String lower) {
        double intensity = 1.0;
        for (Map.Entry<Pattern, Double> e : INTENSIFIERS.entrySet()) {
            if (e.getKey().matcher(lower).find()) {
                intensity *= e.getValue();
            }
        }
        intensity += count(original, '!') * 0.2;
        intensity += count(original, '?') * 0.1;
        intensity += capsWords(original) * 0.3;
        return Math.min(intensity, MAX_INTENSITY);
    }

    private static List<String> indicators(String text) {
        List<String> indicators = new ArrayList<>();
        if (text.indexOf('!') >= 0)                               indicators.add("emphatic");
        if (text.contains("??"))                                  indicators.add("very_confused");
        if (capsWords(text) > 0)                                  indicators.add("strong_emotion");
        if (text.contains("..."))                                 indicators.add("uncertain");
        if (text.contains(":)") || text.contains("😊") || text.contains("😄"))
            indicators.add("positive_emoji");
        if (text.contains(":(") || text.contains("😞") || text.contains("😢"))
            indicators.add("negative_emoji");
        return indicators;
    }

    private static int capsWords(String text) {
        int n = 0;
        for (String word : text.split("\\s+")) {
            String letters = word.replaceAll("[^\\p{L}]", "");
            if (letters.length() > 1 && letters.equals(letters.toUpperCase(Locale.ROOT))) n++;
        }
        return n;
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) n++;
        }
        return n;
    }
}
