package uk.gegc.assessment.features.adaptive.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import uk.gegc.assessment.features.adaptive.application.AdaptiveSessionFactory;
import uk.gegc.assessment.features.adaptive.application.AdaptiveTestSession;
import uk.gegc.assessment.features.adaptive.application.AdaptiveTestingService;
import uk.gegc.assessment.features.adaptive.domain.event.AdaptiveSessionCompletedEvent;
import uk.gegc.assessment.features.adaptive.domain.model.AssessmentItem;
import uk.gegc.assessment.features.adaptive.domain.model.SessionSnapshot;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdaptiveTestingServiceImpl implements AdaptiveTestingService {

    private final AdaptiveSessionFactory sessionFactory;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Override
    public AdaptiveTestSession openSession(List<AssessmentItem> pool) {
        AdaptiveTestSession session = sessionFactory.create(pool);
        meterRegistry.counter("adaptive.sessions.opened").increment();
        log.info("Adaptive session opened: sessionId={}, poolSize={}", session.getSessionId(), pool.size());
        return session;
    }

    @Override
    public SessionSnapshot completeSession(AdaptiveTestSession session) {
        Objects.requireNonNull(session, "session must not be null");
        SessionSnapshot snapshot = session.finish();
        Instant completedAt = Instant.now(clock);

        meterRegistry.counter("adaptive.sessions.completed", "converged", String.valueOf(snapshot.converged())).increment();
        eventPublisher.publishEvent(new AdaptiveSessionCompletedEvent(this, snapshot, completedAt));
        return snapshot;
    }
}
