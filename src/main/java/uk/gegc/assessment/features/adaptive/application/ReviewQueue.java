package uk.gegc.assessment.features.adaptive.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.assessment.features.adaptive.domain.model.AssessmentItem;
import uk.gegc.assessment.features.adaptive.domain.model.ItemParameters;
import uk.gegc.assessment.features.adaptive.domain.model.SessionStatus;
import uk.gegc.assessment.shared.exception.InvalidSessionStateException;

import java.time.Duration;
import java.util.*;

/**
 * Host-side "mark for review" list layered on top of a session.
 * <p>
 * Deferred items stay presented in the session, so adaptive selection skips them, but carry no
 * response until the test-taker commits an answer through {@link #commit}.
 * </p>
 */
@Slf4j
public class ReviewQueue {

    private final AdaptiveTestSession session;
    private final ItemSelector itemSelector;
    private final Map<String, AssessmentItem> deferred = new LinkedHashMap<>();

    public ReviewQueue(AdaptiveTestSession session, ItemSelector itemSelector) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.itemSelector = Objects.requireNonNull(itemSelector, "itemSelector must not be null");
    }

    public void defer(AssessmentItem item) {
        Objects.requireNonNull(item, "item must not be null");
        requireInProgress("defer an item of");
        if (session.getItemParameters(item.id()).isEmpty()) {
            throw new IllegalArgumentException("Item " + item.id() + " is not part of session " + session.getSessionId());
        }
        if (!session.isPresented(item.id())) {
            throw new IllegalStateException("Item " + item.id() + " has not been presented yet");
        }
        if (session.isRecorded(item.id())) {
            throw new IllegalStateException("Item " + item.id() + " already has a recorded response");
        }
        deferred.putIfAbsent(item.id(), item);
        log.debug("Item deferred for review: sessionId={}, itemId={}, pending={}",
                session.getSessionId(), item.id(), deferred.size());
    }

    /**
     * Deferred item that is most informative at the session's current estimate. The item stays queued
     * until it is committed.
     */
    public Optional<AssessmentItem> nextDeferred() {
        requireInProgress("review deferred items of");
        List<ItemParameters> candidates = deferred.keySet().stream()
                .map(id -> session.getItemParameters(id).orElseThrow())
                .toList();
        return itemSelector.nextItem(candidates, Set.of(), session.getTheta())
                .map(parameters -> deferred.get(parameters.itemId()));
    }

    public void commit(String itemId, boolean correct, Duration timeTaken) {
        requireInProgress("commit a deferred item of");
        if (!deferred.containsKey(itemId)) {
            throw new IllegalStateException("Item " + itemId + " is not awaiting review");
        }
        session.recordResponse(itemId, correct, timeTaken);
        deferred.remove(itemId);
    }

    public List<AssessmentItem> pending() {
        return List.copyOf(deferred.values());
    }

    public int size() {
        return deferred.size();
    }

    public boolean isEmpty() {
        return deferred.isEmpty();
    }

    private void requireInProgress(String operation) {
        if (session.getStatus() != SessionStatus.IN_PROGRESS) {
            throw new InvalidSessionStateException(session.getSessionId(), session.getStatus(), operation);
        }
    }
}
