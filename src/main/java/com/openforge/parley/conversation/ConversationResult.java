package com.openforge.parley.conversation;

import com.openforge.parley.decompose.ExecutionPlan;
import com.openforge.parley.decompose.Task;
import com.openforge.parley.nlu.Sentiment;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of processing one utterance.
 *
 * @param outcomes  one per task, in execution order
 * @param cancelled the session ended while the utterance was being processed;
 *                  outcomes after that point are skipped and were not recorded
 */
public record ConversationResult(String sessionId,
                                 Sentiment sentiment,
                                 List<Task> tasks,
                                 ExecutionPlan plan,
                                 List<TaskOutcome> outcomes,
                                 boolean cancelled) {

    public ConversationResult {
        tasks    = List.copyOf(tasks);
        outcomes = List.copyOf(outcomes);
    }

    /** Responses of the handled tasks, one per line. */
    public String response() {
        return outcomes.stream()
                .map(TaskOutcome::response)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n"));
    }
}
