package uk.gegc.assessment.features.adaptive.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.assessment.features.adaptive.domain.model.*;
import uk.gegc.assessment.shared.exception.InvalidSessionStateException;
import uk.gegc.assessment.shared.exception.UnknownItemException;

import java.time.Duration;
import java.util.*;

/**
 * State of one adaptive test attempt by one test-taker.
 * <p>
 * Lifecycle is {@code NOT_STARTED -> IN_PROGRESS -> COMPLETED}. Responses can only be recorded while
 * in progress; once completed the session is read-only. Instances are not thread-safe and must be
 * owned by a single attempt.
 * </p>
 * <p>
 * An item counts as presented as soon as it is selected, so an item that the host deferred is never
 * selected again. Each item accepts at most one response.
 * </p>
 */
@Slf4j
public class AdaptiveTestSession {

    private final UUID sessionId;
    private final AbilityEstimator abilityEstimator;
    private final ItemSelector itemSelector;

    private final Map<String, AssessmentItem> itemsById;
    private final Map<String, ItemParameters> parametersById;
    private final List<ItemParameters> calibratedPool;

    private final List<RecordedResponse> responses = new ArrayList<>();
    private final Set<String> presentedItemIds = new LinkedHashSet<>();
    private final Set<String> recordedItemIds = new HashSet<>();

    private SessionStatus status = SessionStatus.NOT_STARTED;
    private double theta = AbilityEstimator.INITIAL_THETA;

    public AdaptiveTestSession(UUID sessionId,
                               List<AssessmentItem> pool,
                               ItemCalibrator itemCalibrator,
                               AbilityEstimator abilityEstimator,
                               ItemSelector itemSelector) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(pool, "pool must not be null");
        Objects.requireNonNull(itemCalibrator, "itemCalibrator must not be null");
        this.abilityEstimator = Objects.requireNonNull(abilityEstimator, "abilityEstimator must not be null");
        this.itemSelector = Objects.requireNonNull(itemSelector, "itemSelector must not be null");

        if (pool.isEmpty()) {
            throw new IllegalArgumentException("Item pool must not be empty");
        }

        Map<String, AssessmentItem> items = new LinkedHashMap<>();
        Map<String, ItemParameters> parameters = new LinkedHashMap<>();
        for (AssessmentItem item : pool) {
            Objects.requireNonNull(item, "pool must not contain null items");
            if (items.putIfAbsent(item.id(), item) != null) {
                throw new IllegalArgumentException("Duplicate item id " + item.id() + " in pool");
            }
            parameters.put(item.id(), itemCalibrator.calibrate(item));
        }
        this.itemsById = Collections.unmodifiableMap(items);
        this.parametersById = Collections.unmodifiableMap(parameters);
        this.calibratedPool = List.copyOf(parameters.values());
    }

    /**
     * Starts the session and presents the item closest to average difficulty.
     */
    public AssessmentItem start() {
        if (status != SessionStatus.NOT_STARTED) {
            throw new InvalidSessionStateException(sessionId, status, "start");
        }
        ItemParameters first = itemSelector.firstItem(calibratedPool)
                .orElseThrow(() -> new IllegalStateException("Item pool of session " + sessionId + " is empty"));
        status = SessionStatus.IN_PROGRESS;
        presentedItemIds.add(first.itemId());

        log.info("Adaptive session started: sessionId={}, poolSize={}, firstItemId={}, b={}, thetaRange=[{}, {}]",
                sessionId, calibratedPool.size(), first.itemId(), first.difficulty(),
                abilityEstimator.minTheta(), abilityEstimator.maxTheta());
        return itemsById.get(first.itemId());
    }

    /**
     * Records the response and presents the next item.
     *
     * @return the next item, or empty when every item of the pool has been presented
     */
    public Optional<AssessmentItem> recordResponseAndAdvance(String itemId, boolean correct, Duration timeTaken) {
        recordResponse(itemId, correct, timeTaken);
        return nextItem();
    }

    /**
     * Records the response and updates the ability estimate without selecting another item.
     */
    public void recordResponse(String itemId, boolean correct, Duration timeTaken) {
        requireInProgress("record a response in");
        ItemParameters parameters = parametersOf(itemId);
        Objects.requireNonNull(timeTaken, "timeTaken must not be null");
        if (timeTaken.isNegative()) {
            throw new IllegalArgumentException("timeTaken must not be negative, was " + timeTaken);
        }
        if (recordedItemIds.contains(itemId)) {
            throw new IllegalStateException("Item " + itemId + " already has a recorded response in session " + sessionId);
        }

        double before = theta;
        responses.add(new RecordedResponse(itemId, correct, timeTaken, parameters.difficulty()));
        theta = abilityEstimator.update(theta, parameters.difficulty(), correct);
        recordedItemIds.add(itemId);
        presentedItemIds.add(itemId);

        log.debug("Response recorded: sessionId={}, itemId={}, b={}, correct={}, theta {} -> {}",
                sessionId, itemId, parameters.difficulty(), correct, before, theta);
    }

    /**
     * Presents the unpresented item with maximum information at the current estimate.
     *
     * @return the item, or empty when the pool is exhausted
     */
    public Optional<AssessmentItem> nextItem() {
        requireInProgress("select the next item of");
        Optional<ItemParameters> next = itemSelector.nextItem(calibratedPool, presentedItemIds, theta);
        if (next.isEmpty()) {
            log.debug("Item pool exhausted: sessionId={}, responses={}", sessionId, responses.size());
            return Optional.empty();
        }
        ItemParameters selected = next.get();
        presentedItemIds.add(selected.itemId());
        log.debug("Item selected: sessionId={}, itemId={}, b={}, theta={}",
                sessionId, selected.itemId(), selected.difficulty(), theta);
        return Optional.of(itemsById.get(selected.itemId()));
    }

    /**
     * Completes the session. Further mutations are rejected.
     */
    public SessionSnapshot finish() {
        requireInProgress("finish");
        status = SessionStatus.COMPLETED;
        SessionSnapshot snapshot = snapshot();
        log.info("Adaptive session completed: sessionId={}, responses={}, theta={}, standardError={}, converged={}",
                sessionId, responses.size(), snapshot.finalTheta(), snapshot.standardError(), snapshot.converged());
        return snapshot;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public double getTheta() {
        return theta;
    }

    public double getStandardError() {
        return abilityEstimator.standardError(theta, responses);
    }

    public boolean hasConverged() {
        return abilityEstimator.hasConverged(theta, responses);
    }

    public AbilityLevel getAbilityLevel() {
        return AbilityLevel.fromTheta(theta);
    }

    public List<RecordedResponse> getResponses() {
        return List.copyOf(responses);
    }

    public List<Double> getThetaTrajectory() {
        return abilityEstimator.trajectory(responses);
    }

    public Optional<ItemParameters> getItemParameters(String itemId) {
        return Optional.ofNullable(parametersById.get(itemId));
    }

    /**
     * Probability of a correct answer to the given item at the current estimate.
     */
    public double predictSuccess(String itemId) {
        return RaschModel.probabilityCorrect(theta, parametersOf(itemId).difficulty());
    }

    public boolean isPresented(String itemId) {
        return presentedItemIds.contains(itemId);
    }

    public boolean isRecorded(String itemId) {
        return recordedItemIds.contains(itemId);
    }

    public int remainingItemCount() {
        return calibratedPool.size() - presentedItemIds.size();
    }

    public SessionStatistics getStatistics() {
        int total = responses.size();
        int correct = 0;
        Duration totalTime = Duration.ZERO;
        Map<CognitiveLevel, LevelTally> byLevel = new EnumMap<>(CognitiveLevel.class);
        Map<DifficultyLabel, LevelTally> byLabel = new EnumMap<>(DifficultyLabel.class);
        for (CognitiveLevel level : CognitiveLevel.values()) {
            byLevel.put(level, LevelTally.EMPTY);
        }
        for (DifficultyLabel label : DifficultyLabel.values()) {
            byLabel.put(label, LevelTally.EMPTY);
        }

        for (RecordedResponse response : responses) {
            ItemParameters parameters = parametersById.get(response.itemId());
            if (response.correct()) {
                correct++;
            }
            totalTime = totalTime.plus(response.timeTaken());
            byLevel.put(parameters.cognitiveLevel(), byLevel.get(parameters.cognitiveLevel()).add(response.correct()));
            byLabel.put(parameters.difficultyLabel(), byLabel.get(parameters.difficultyLabel()).add(response.correct()));
        }

        int accuracy = total == 0 ? 0 : (int) Math.round(correct * 100.0 / total);
        Duration averageTime = total == 0 ? Duration.ZERO : totalTime.dividedBy(total);
        double standardError = getStandardError();

        return new SessionStatistics(
                total,
                correct,
                total - correct,
                accuracy,
                theta,
                getAbilityLevel(),
                standardError,
                hasConverged(),
                averageTime,
                Collections.unmodifiableMap(byLevel),
                Collections.unmodifiableMap(byLabel)
        );
    }

    public SessionSnapshot snapshot() {
        SessionStatistics statistics = getStatistics();
        return new SessionSnapshot(
                sessionId,
                status,
                theta,
                getThetaTrajectory(),
                statistics.standardError(),
                statistics.converged(),
                statistics.abilityLevel(),
                responses,
                statistics
        );
    }

    private ItemParameters parametersOf(String itemId) {
        ItemParameters parameters = itemId == null ? null : parametersById.get(itemId);
        if (parameters == null) {
            throw new UnknownItemException(itemId);
        }
        return parameters;
    }

    private void requireInProgress(String operation) {
        if (status != SessionStatus.IN_PROGRESS) {
            throw new InvalidSessionStateException(sessionId, status, operation);
        }
    }
}
