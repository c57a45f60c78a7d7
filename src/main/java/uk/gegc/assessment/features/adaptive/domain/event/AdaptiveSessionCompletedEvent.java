package uk.gegc.assessment.features.adaptive.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.assessment.features.adaptive.domain.model.SessionSnapshot;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event published when an adaptive session is finished.
 * <p>
 * Carries the final snapshot so that persistence and analytics can react without the engine
 * knowing about storage.
 * </p>
 */
public class AdaptiveSessionCompletedEvent extends ApplicationEvent {

    private final SessionSnapshot snapshot;
    private final Instant completedAt;

    public AdaptiveSessionCompletedEvent(Object source, SessionSnapshot snapshot, Instant completedAt) {
        super(source);
        this.snapshot = snapshot;
        this.completedAt = completedAt;
    }

    public UUID getSessionId() {
        return snapshot.sessionId();
    }

    public SessionSnapshot getSnapshot() {
        return snapshot;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
