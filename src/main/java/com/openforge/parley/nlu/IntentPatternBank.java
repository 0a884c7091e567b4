package com.openforge.parley.nlu;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit, ordered grammar bank used by the pattern stage of
 * {@link IntentClassifier}.
 *
 * Precedence is the declared order: categories first, then patterns within a
 * category. Adding a pattern to one category never changes how another
 * category's patterns rank against each other.
 */
public final class IntentPatternBank {

    private static final String NUM = "[-+]?\\d+(?:\\.\\d+)?";
    private static final String OP  = "(?:[-+*/x×÷^]|plus|minus|times|divided by|multiplied by|to the power of)";

    private final Map<IntentCategory, List<IntentPattern>> byCategory;

    public IntentPatternBank(Map<IntentCategory, List<IntentPattern>> byCategory) {
        Map<IntentCategory, List<IntentPattern>> copy = new LinkedHashMap<>();
        byCategory.forEach((category, patterns) -> copy.put(category, List.copyOf(patterns)));
        this.byCategory = Collections.unmodifiableMap(copy);
    }

    /** All patterns in precedence order. */
    public List<IntentPattern> patterns() {
        List<IntentPattern> all = new ArrayList<>();
        byCategory.values().forEach(all::addAll);
        return all;
    }

    public List<IntentPattern> patternsFor(IntentCategory category) {
        return byCategory.getOrDefault(category, List.of());
    }

    public List<IntentCategory> categories() {
        return List.copyOf(byCategory.keySet());
    }

    /** The built-in grammar bank. */
    public static IntentPatternBank defaults() {
        Map<IntentCategory, List<IntentPattern>> bank = new LinkedHashMap<>();

        bank.put(IntentCategory.COMMAND, List.of(
                new IntentPattern(IntentCategory.COMMAND, "cli",
                        "(?:run\\s+)?(?:npm|pip|git|docker|kubectl|yarn|cargo|mvn|gradlew|gradle|python)\\s+[\\w-]+.*"),
                new IntentPattern(IntentCategory.COMMAND, "game_command",
                        "/(?:give|tp|gamemode|time|weather|summon|kill)\\b.*"),
                new IntentPattern(IntentCategory.COMMAND, "app_control",
                        "(?:please\\s+)?(?:open|launch|start|close|quit)\\s+(?:the\\s+)?[\\w .-]+",
                        SlotSchema.of(SlotSpec.required("target", EntityType.APPLICATION,
                                "(?:open|launch|start|close|quit)\\s+(?:the\\s+)?([\\w .-]+)"))),
                new IntentPattern(IntentCategory.COMMAND, "device_control",
                        "(?:turn|switch)\\s+(?:on|off)\\s+.+|(?:set|increase|decrease)\\s+(?:the\\s+)?(?:volume|brightness).*"
                                + "|(?:mute|unmute|pause|play|lock|restart|shut down)\\b.*")));

        bank.put(IntentCategory.MATH, List.of(
                new IntentPattern(IntentCategory.MATH, "arithmetic",
                        "(?:what\\s+is\\s+|calculate\\s+|compute\\s+)?" + NUM + "\\s*" + OP + "\\s*" + NUM
                                + "(?:\\s*" + OP + "\\s*" + NUM + ")*\\s*(?:=|equals)?\\s*"),
                new IntentPattern(IntentCategory.MATH, "calculate",
                        "(?:calculate|compute|solve|evaluate|differentiate|integrate)(?:\\s+.+)?",
                        SlotSchema.of(SlotSpec.required("expression", null,
                                "(?:calculate|compute|solve|evaluate|differentiate|integrate)\\s+(.+)"))),
                new IntentPattern(IntentCategory.MATH, "math_terms",
                        ".*\\b(?:derivative|integral|equation|square root|factorial|percent of)\\b.*")));

        bank.put(IntentCategory.CODE, List.of(
                new IntentPattern(IntentCategory.CODE, "write_code",
                        "(?:write|create|implement|generate|build)\\s+.*\\b(?:function|class|method|script|program"
                                + "|algorithm|handler|code|api|loop|query|component|schema)s?\\b.*"),
                new IntentPattern(IntentCategory.CODE, "repair_code",
                        "(?:debug|fix|refactor|optimi[sz]e|review)\\s+.+")));

        bank.put(IntentCategory.FETCH, List.of(
                new IntentPattern(IntentCategory.FETCH, "search",
                        "(?:search|look)\\s+(?:for|up)(?:\\s+.+)?",
                        SlotSchema.of(SlotSpec.required("query", null,
                                "(?:search|look)\\s+(?:for|up)\\s+(.+)"))),
                new IntentPattern(IntentCategory.FETCH, "retrieve",
                        "(?:find|fetch|get)\\s+(?:me\\s+)?(?:the\\s+)?(?:latest\\s+)?.+",
                        SlotSchema.of(SlotSpec.required("query", null,
                                "(?:find|fetch|get)\\s+(?:me\\s+)?(?:the\\s+)?(?:latest\\s+)?(.+)")))));

        bank.put(IntentCategory.QUESTION, List.of(
                new IntentPattern(IntentCategory.QUESTION, "wh_question",
                        "(?:what|who|where|when|why|how|which)\\b.+"),
                new IntentPattern(IntentCategory.QUESTION, "explain",
                        "(?:explain|describe|define|tell me about)\\s+.+"),
                new IntentPattern(IntentCategory.QUESTION, "yes_no",
                        "(?:is|are|can|does|do|should|could|would)\\s+(?:it|there|this|that|i|you|we|they|he|she)\\b.+")));

        bank.put(IntentCategory.CONVERSATIONAL, List.of(
                new IntentPattern(IntentCategory.CONVERSATIONAL, "greeting",
                        "(?:hi|hello|hey|greetings|good (?:morning|afternoon|evening))(?:\\s+\\w+)?"),
                new IntentPattern(IntentCategory.CONVERSATIONAL, "thanks",
                        "(?:thanks|thank you|thx|cheers)\\b.*"),
                new IntentPattern(IntentCategory.CONVERSATIONAL, "farewell",
                        "(?:bye|goodbye|see you|good night)\\b.*"),
                new IntentPattern(IntentCategory.CONVERSATIONAL, "acknowledgement",
                        "(?:ok|okay|sure|got it|understood|cool|great|perfect|that'?s (?:perfect|great|awesome|cool))")));

        return new IntentPatternBank(bank);
    }
}
