package com.openforge.parley.router;

/**
 * @param handledBy  name of the handler that produced {@code result}
 * @param confidence confidence of the routed intent
 */
public record RouteResult(String handledBy, HandlerResult result, double confidence) {

    public boolean isClarification() {
        return result.clarification();
    }
}
