package com.openforge.parley.router;

/**
 * The handler chain cannot guarantee a result: the fallback failed, or the
 * chain lacks its reserved first or last handler.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
