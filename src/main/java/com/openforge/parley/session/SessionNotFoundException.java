package com.openforge.parley.session;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("No open session with id " + sessionId);
    }
}
