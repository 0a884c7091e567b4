package com.openforge.parley.decompose;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits compound utterances into ordered subtasks.
 *
 * Rules, first match wins:
 *   1. Sequencing connectives ("then", "after that", "finally", ...) at a
 *      clause boundary, with a real clause on each side
 *      → SEQUENTIAL, task i depends on task i-1.
 *   2. Two or more imperative clauses joined by "and" or commas
 *      → PARALLEL, no dependencies.
 *   3. "if ... then ... [else ...]"
 *      → one CONDITIONAL task carrying condition and branches.
 *   4. "compare X and Y" / "difference between X and Y"
 *      → two independent COMPARISON tasks.
 *   5. Anything else → one SIMPLE task holding the whole input.
 *
 * Utterances opening with "if" skip rules 1 and 2 so that a conditional's
 * own "then" is not read as a sequence.
 */
@Slf4j
@Component
public class QueryDecomposer {

    /**
     * Connectives at a clause boundary: after a comma, semicolon or "and".
     * A bare "then" / "after that" (group {@code bare}) only counts when the
     * clause before it is a command; "since then" and "back then" do not split.
     */
    private static final Pattern SEQUENCE_SPLIT = Pattern.compile(
            "\\s*[,;]\\s*(?:and\\s+)?(?:then|after that|afterwards|finally)\\b\\s*,?\\s*"
                    + "|\\s+and\\s+(?:then|after that|afterwards|finally)\\b\\s*,?\\s*"
                    + "|\\s*[,;.]\\s*next\\b\\s*,?\\s*"
                    + "|(?<bare>\\s+(?:then|after that|afterwards)\\s+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_AND = Pattern.compile("^and\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_ORDINAL = Pattern.compile(
            "^(?:first of all|firstly|first)\\b\\s*,?\\s*", Pattern.CASE_INSENSITIVE);

    private static final Pattern PARALLEL_SPLIT = Pattern.compile(
            "\\s*,\\s*(?:and\\s+)?|\\s+and\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONDITIONAL = Pattern.compile(
            "^if\\s+(.+?)(?:,?\\s+then\\s+|\\s*,\\s*)(.+?)(?:\\s*,?\\s+(?:else|otherwise)\\s*,?\\s+(.+))?$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern STARTS_WITH_IF = Pattern.compile("^if\\b", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> COMPARISONS = List.of(
            Pattern.compile("^(?:please\\s+)?compare\\s+(.+?)\\s+(?:and|with|to|vs\\.?|versus)\\s+(.+)$",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(?:what(?:'s| is| are)\\s+the\\s+)?differences?\\s+between\\s+(.+?)\\s+and\\s+(.+)$",
                    Pattern.CASE_INSENSITIVE));

    static final Set<String> IMPERATIVE_VERBS = Set.of(
            "open", "close", "launch", "start", "stop", "quit", "play", "pause", "mute", "search",
            "find", "get", "fetch", "show", "tell", "give", "write", "create", "make", "build",
            "explain", "describe", "define", "calculate", "compute", "solve", "summarize",
            "summarise", "check", "send", "set", "turn", "remind", "look", "list", "read",
            "download", "install", "run", "translate", "book", "call", "email", "schedule",
            "add", "remove", "delete", "update", "take", "save", "restart", "lock");

    // ── Decomposition ────────────────────────────────────────────────────────

    public List<Task> decompose(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String input = stripTrailingPunctuation(text.trim().replaceAll("\\s+", " "));
        if (input.isEmpty()) {
            return List.of();
        }

        boolean conditionalForm = STARTS_WITH_IF.matcher(input).find();
        List<Task> tasks = null;
        if (!conditionalForm) {
            tasks = sequential(input);
            if (tasks == null && !isComparison(input)) {
                tasks = parallel(input);
            }
        }
        if (tasks == null && conditionalForm) tasks = conditional(input);
        if (tasks == null) tasks = comparison(input);
        if (tasks == null) tasks = List.of(Task.simple(input));

        if (tasks.size() > 1 || tasks.get(0).type() != TaskType.SIMPLE) {
            log.debug("[Decomposer] '{}' → {} {} task(s)", input, tasks.size(), tasks.get(0).type());
        }
        return tasks;
    }

    private List<Task> sequential(String input) {
        List<String> parts = new ArrayList<>();
        Matcher m = SEQUENCE_SPLIT.matcher(input);
        int start = 0;
        while (m.find()) {
            String before = clause(input.substring(start, m.start()));
            if (m.group("bare") != null && !isImperative(before)) {
                continue;
            }
            parts.add(before);
            start = m.end();
        }
        if (parts.isEmpty()) {
            return null;
        }
        parts.add(clause(input.substring(start)));
        if (!parts.stream().allMatch(QueryDecomposer::isClause)) {
            return null;
        }

        List<Task> tasks = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            tasks.add(Task.of(i, parts.get(i), TaskType.SEQUENTIAL, i == 0 ? List.of() : List.of(i - 1)));
        }
        return tasks;
    }

    private List<Task> parallel(String input) {
        List<String> parts = clauses(PARALLEL_SPLIT.split(input));
        if (parts.size() < 2 || !parts.stream().allMatch(QueryDecomposer::isImperative)) {
            return null;
        }
        List<Task> tasks = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            tasks.add(Task.of(i, parts.get(i), TaskType.PARALLEL, List.of()));
        }
        return tasks;
    }

    private List<Task> conditional(String input) {
        Matcher m = CONDITIONAL.matcher(input);
        if (!m.matches()) {
            return null;
        }
        return List.of(Task.conditional(input, m.group(1).trim(), m.group(2).trim(),
                m.group(3) == null ? null : m.group(3).trim()));
    }

    private List<Task> comparison(String input) {
        for (Pattern pattern : COMPARISONS) {
            Matcher m = pattern.matcher(input);
            if (m.matches()) {
                return List.of(
                        Task.comparison(0, m.group(1).trim()),
                        Task.comparison(1, m.group(2).trim()));
            }
        }
        return null;
    }

    private static boolean isComparison(String input) {
        return COMPARISONS.stream().anyMatch(p -> p.matcher(input).matches());
    }

    // ── Execution planning ───────────────────────────────────────────────────

    /**
     * Topological order of {@code tasks} (Kahn), taking the earliest declared
     * ready task first. Also groups tasks into stages that could run together.
     *
     * @throws IllegalArgumentException if a dependency names a task not in the list
     * @throws CycleDetectedException   if dependencies form a cycle
     */
    public ExecutionPlan createExecutionPlan(List<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return ExecutionPlan.empty();
        }

        Map<Integer, Integer> positionOf = new HashMap<>();
        for (int pos = 0; pos < tasks.size(); pos++) {
            if (positionOf.put(tasks.get(pos).index(), pos) != null) {
                throw new IllegalArgumentException("Duplicate task index " + tasks.get(pos).index());
            }
        }

        int n = tasks.size();
        int[] inDegree = new int[n];
        List<List<Integer>> dependents = new ArrayList<>(n);
        for (int i = 0; i < n; i++) dependents.add(new ArrayList<>());
        for (int pos = 0; pos < n; pos++) {
            for (int dep : tasks.get(pos).dependencies()) {
                Integer depPos = positionOf.get(dep);
                if (depPos == null) {
                    throw new IllegalArgumentException(
                            "Task " + tasks.get(pos).index() + " depends on unknown task " + dep);
                }
                dependents.get(depPos).add(pos);
                inDegree[pos]++;
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        int[] level = new int[n];
        for (int pos = 0; pos < n; pos++) {
            if (inDegree[pos] == 0) ready.add(pos);
        }

        List<Integer> order = new ArrayList<>(n);
        TreeMap<Integer, List<Integer>> stages = new TreeMap<>();
        while (!ready.isEmpty()) {
            int pos = ready.poll();
            order.add(tasks.get(pos).index());
            stages.computeIfAbsent(level[pos], k -> new ArrayList<>()).add(tasks.get(pos).index());
            for (int next : dependents.get(pos)) {
                level[next] = Math.max(level[next], level[pos] + 1);
                if (--inDegree[next] == 0) ready.add(next);
            }
        }

        if (order.size() < n) {
            List<Integer> unresolved = new ArrayList<>();
            for (int pos = 0; pos < n; pos++) {
                if (inDegree[pos] > 0) unresolved.add(tasks.get(pos).index());
            }
            log.error("[Decomposer] Dependency cycle among tasks {}", unresolved);
            throw new CycleDetectedException(unresolved);
        }
        return new ExecutionPlan(order, n, new ArrayList<>(stages.values()));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static List<String> clauses(String[] raw) {
        return Arrays.stream(raw)
                .map(String::trim)
                .map(QueryDecomposer::stripTrailingPunctuation)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String clause(String raw) {
        String trimmed = stripTrailingPunctuation(raw.trim());
        trimmed = LEADING_AND.matcher(trimmed).replaceFirst("");
        return LEADING_ORDINAL.matcher(trimmed).replaceFirst("");
    }

    /** A command, or at least two words; "why" alone is not a subtask. */
    private static boolean isClause(String clause) {
        return !clause.isEmpty() && (clause.split("\\s+").length >= 2 || isImperative(clause));
    }

    private static boolean isImperative(String clause) {
        String first = clause.split("\\s+", 2)[0].toLowerCase(Locale.ROOT);
        if (first.equals("please")) {
            String[] words = clause.split("\\s+", 3);
            first = words.length > 1 ? words[1].toLowerCase(Locale.ROOT) : "";
        }
        return IMPERATIVE_VERBS.contains(first);
    }

    private static String stripTrailingPunctuation(String s) {
        return s.replaceAll("[\\s.!?,;]+$", "");
    }
}
