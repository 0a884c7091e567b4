package com.openforge.parley.session;

/** The session ended (closed or expired) before or during the call. */
public class SessionClosedException extends RuntimeException {

    public SessionClosedException(String sessionId, SessionStatus status) {
        super("Session " + sessionId + " is " + status);
    }
}
