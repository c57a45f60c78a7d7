package uk.gegc.assessment.shared.exception;

import uk.gegc.assessment.features.adaptive.domain.model.SessionStatus;

import java.util.UUID;

/**
 * Exception thrown when a session operation is invoked in a state that does not allow it,
 * e.g. recording a response after the session was finished.
 */
public class InvalidSessionStateException extends IllegalStateException {

    private final UUID sessionId;
    private final SessionStatus status;

    public InvalidSessionStateException(UUID sessionId, SessionStatus status, String operation) {
        super("Cannot " + operation + " session " + sessionId + " with status " + status);
        this.sessionId = sessionId;
        this.status = status;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
