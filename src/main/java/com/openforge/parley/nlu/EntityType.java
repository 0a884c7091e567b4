package com.openforge.parley.nlu;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Typed entity kinds recognised by {@link EntityExtractor}.
 *
 * Declaration order is the matcher priority: when two matches cover spans of
 * equal length, the type declared first wins. IDENTIFIER and AMOUNT have no
 * pattern of their own; they are produced by re-reading a bare NUMBER against
 * nearby keywords.
 *
 * A pattern with a capturing group contributes group 1 as the entity value.
 */
public enum EntityType {

    URL("https?://[^\\s<>\"']*[^\\s<>\"'.,;:!?)]", 0),
    EMAIL("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b", 0),
    FILE_PATH("(?:[A-Za-z]:\\\\|~/|\\./|/)?(?:[\\w.-]+[/\\\\])*[\\w-]+\\.[A-Za-z]\\w{0,7}\\b", 0),
    IP_ADDRESS("\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b", 0),
    TIME("\\b(?:(?:[01]?\\d|2[0-3]):[0-5]\\d(?::[0-5]\\d)?(?:\\s*[ap]m\\b)?|(?:1[0-2]|0?[1-9])\\s*[ap]m\\b)",
            Pattern.CASE_INSENSITIVE),
    MONEY("[$€£₹]\\s*\\d+(?:,\\d{3})*(?:\\.\\d{1,2})?", 0),
    PERCENTAGE("\\b\\d+(?:\\.\\d+)?%", 0),
    VERSION("\\bv\\d+(?:\\.\\d+)+\\b|\\b\\d+\\.\\d+\\.\\d+(?:-[\\w.]+)?\\b", Pattern.CASE_INSENSITIVE),
    CLI_COMMAND("\\b(?:npm|pip|git|docker|kubectl|yarn|cargo|mvn|gradlew|gradle|python)\\s+[\\w-]+"
            + "|(?<!\\S)/(?:give|tp|gamemode|time|weather|summon|kill)\\b", Pattern.CASE_INSENSITIVE),
    RELATIVE_DATE("\\b(?:today|tomorrow|yesterday|tonight|(?:next|last)\\s+(?:week|month|year))\\b",
            Pattern.CASE_INSENSITIVE),
    TIME_PERIOD("\\b(?:morning|afternoon|evening|night)\\b", Pattern.CASE_INSENSITIVE),
    APPLICATION("\\b(?:chrome|firefox|visual studio code|vscode|notepad|calculator|spotify|discord|slack|terminal)\\b",
            Pattern.CASE_INSENSITIVE),
    LOCATION("\\b(?:in|at)\\s+([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*)", 0),
    NUMBER("\\b\\d+(?:\\.\\d+)?\\b|\\b(?:one|two|three|four|five|six|seven|eight|nine|ten)\\b",
            Pattern.CASE_INSENSITIVE),

    IDENTIFIER(null, 0),
    AMOUNT(null, 0);

    private final Pattern pattern;

    EntityType(String regex, int flags) {
        this.pattern = regex == null ? null : Pattern.compile(regex, flags);
    }

    /** Pattern for this type, or {@code null} for derived types. */
    public Pattern pattern() {
        return pattern;
    }

    /** Key under which the first entity of this type is reported. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
