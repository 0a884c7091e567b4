package com.openforge.parley.conversation;

import com.openforge.parley.decompose.Task;
import com.openforge.parley.nlu.Intent;
import com.openforge.parley.router.RouteResult;

/**
 * How one subtask was understood and handled.
 *
 * @param route {@code null} when the task was skipped
 */
public record TaskOutcome(Task task, Intent intent, RouteResult route) {

    public boolean isHandled() {
        return route != null;
    }

    public String response() {
        return route == null ? null : route.result().response();
    }
}
