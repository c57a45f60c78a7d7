package uk.gegc.assessment.features.adaptive.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.assessment.BaseUnitTest;
import uk.gegc.assessment.features.adaptive.domain.model.*;
import uk.gegc.assessment.shared.exception.InvalidSessionStateException;
import uk.gegc.assessment.shared.exception.UnknownItemException;
import uk.gegc.assessment.testsupport.ItemPools;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AdaptiveTestSession Tests")
class AdaptiveTestSessionTest extends BaseUnitTest {

    private static final Duration TEN_SECONDS = Duration.ofSeconds(10);

    private AdaptiveTestSession session;

    @BeforeEach
    void setUp() {
        session = ItemPools.newSession(ItemPools.threeTierPool());
    }

    @Nested
    @DisplayName("Three-item scenario")
    class ThreeItemScenario {

        @Test
        @DisplayName("Should start with the b = 0 item, drop to -0.2 on a miss and then offer the easy item")
        void shouldFollowMaximumInformationPath() {
            AssessmentItem first = session.start();
            assertEquals("comprehension-medium", first.id());
            assertEquals(SessionStatus.IN_PROGRESS, session.getStatus());

            Optional<AssessmentItem> second = session.recordResponseAndAdvance(first.id(), false, TEN_SECONDS);

            assertEquals(-0.2, session.getTheta(), 1e-12);
            assertThat(second).map(AssessmentItem::id).contains("recall-easy");
        }

        @Test
        @DisplayName("Should pick the earlier of two mirrored items when the first item is left unanswered")
        void shouldKeepPoolOrderForMirroredItemsAfterSkippingFirst() {
            List<AssessmentItem> pool = List.of(
                    ItemPools.item("neutral", CognitiveLevel.COMPREHENSION, DifficultyLabel.MEDIUM),
                    ItemPools.item("comp-hard", CognitiveLevel.COMPREHENSION, DifficultyLabel.HARD),
                    ItemPools.item("comp-easy", CognitiveLevel.COMPREHENSION, DifficultyLabel.EASY)
            );
            AdaptiveTestSession mirrored = ItemPools.newSession(pool);

            assertEquals("neutral", mirrored.start().id());

            assertEquals(0.0, mirrored.getTheta());
            assertThat(mirrored.nextItem()).map(AssessmentItem::id).contains("comp-hard");
            assertThat(mirrored.nextItem()).map(AssessmentItem::id).contains("comp-easy");
        }

        @Test
        @DisplayName("Should signal exhaustion after every item was presented and allow finishing")
        void shouldExhaustPoolAndFinish() {
            AssessmentItem first = session.start();
            AssessmentItem second = session.recordResponseAndAdvance(first.id(), false, TEN_SECONDS).orElseThrow();
            AssessmentItem third = session.recordResponseAndAdvance(second.id(), true, TEN_SECONDS).orElseThrow();
            assertEquals("application-hard", third.id());

            Optional<AssessmentItem> none = session.recordResponseAndAdvance(third.id(), false, TEN_SECONDS);

            assertThat(none).isEmpty();
            assertEquals(0, session.remainingItemCount());

            SessionSnapshot snapshot = session.finish();
            assertEquals(SessionStatus.COMPLETED, snapshot.status());
            assertEquals(SessionStatus.COMPLETED, session.getStatus());
            assertThat(snapshot.responses()).extracting(RecordedResponse::itemId)
                    .containsExactly("comprehension-medium", "recall-easy", "application-hard");
        }
    }

    @Nested
    @DisplayName("State machine")
    class StateMachine {

        @Test
        @DisplayName("Should reject recording before start")
        void shouldRejectRecordingBeforeStart() {
            InvalidSessionStateException ex = assertThrows(InvalidSessionStateException.class,
                    () -> session.recordResponse("recall-easy", true, TEN_SECONDS));

            assertEquals(SessionStatus.NOT_STARTED, ex.getStatus());
            assertEquals(session.getSessionId(), ex.getSessionId());
        }

        @Test
        @DisplayName("Should reject starting twice")
        void shouldRejectSecondStart() {
            session.start();

            assertThrows(InvalidSessionStateException.class, () -> session.start());
        }

        @Test
        @DisplayName("Should reject finishing a session that never started")
        void shouldRejectFinishBeforeStart() {
            assertThrows(InvalidSessionStateException.class, () -> session.finish());
        }

        @Test
        @DisplayName("Should become read-only after finish")
        void shouldRejectMutationsAfterFinish() {
            AssessmentItem first = session.start();
            session.recordResponse(first.id(), true, TEN_SECONDS);
            session.finish();

            assertThatThrownBy(() -> session.recordResponseAndAdvance("recall-easy", true, TEN_SECONDS))
                    .isInstanceOf(InvalidSessionStateException.class)
                    .hasMessageContaining("COMPLETED");
            assertThrows(InvalidSessionStateException.class, () -> session.nextItem());
            assertThrows(InvalidSessionStateException.class, () -> session.finish());

            assertEquals(1, session.getResponses().size());
            assertThat(session.getStatistics().totalResponses()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should allow finishing before the pool is exhausted")
        void shouldFinishEarly() {
            session.start();

            SessionSnapshot snapshot = session.finish();

            assertEquals(0, snapshot.responses().size());
            assertEquals(AbilityEstimator.UNBOUNDED_STANDARD_ERROR, snapshot.standardError());
            assertFalse(snapshot.converged());
        }
    }

    @Nested
    @DisplayName("Input validation")
    class InputValidation {

        @Test
        @DisplayName("Should reject a response for an item outside the pool")
        void shouldRejectUnknownItem() {
            session.start();

            UnknownItemException ex = assertThrows(UnknownItemException.class,
                    () -> session.recordResponse("not-in-pool", true, TEN_SECONDS));

            assertEquals("not-in-pool", ex.getItemId());
            assertThat(session.getResponses()).isEmpty();
            assertEquals(0.0, session.getTheta());
        }

        @Test
        @DisplayName("Should reject a second response for the same item")
        void shouldRejectDuplicateResponse() {
            AssessmentItem first = session.start();
            session.recordResponse(first.id(), true, TEN_SECONDS);
            double theta = session.getTheta();

            assertThrows(IllegalStateException.class, () -> session.recordResponse(first.id(), false, TEN_SECONDS));
            assertEquals(theta, session.getTheta());
            assertEquals(1, session.getResponses().size());
        }

        @Test
        @DisplayName("Should reject negative or missing response times")
        void shouldRejectInvalidTimes() {
            AssessmentItem first = session.start();

            assertThrows(IllegalArgumentException.class, () -> session.recordResponse(first.id(), true, Duration.ofSeconds(-1)));
            assertThrows(NullPointerException.class, () -> session.recordResponse(first.id(), true, null));
            assertThat(session.getResponses()).isEmpty();
        }

        @Test
        @DisplayName("Should reject empty pools and duplicate ids at construction")
        void shouldRejectInvalidPools() {
            assertThrows(IllegalArgumentException.class, () -> ItemPools.newSession(List.of()));

            AssessmentItem item = ItemPools.item("dup", CognitiveLevel.RECALL, DifficultyLabel.EASY);
            AssessmentItem twin = ItemPools.item("dup", CognitiveLevel.APPLICATION, DifficultyLabel.HARD);
            assertThatThrownBy(() -> ItemPools.newSession(List.of(item, twin)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("dup");
        }

        @Test
        @DisplayName("Should reject predictions for unknown items")
        void shouldRejectUnknownPrediction() {
            assertThrows(UnknownItemException.class, () -> session.predictSuccess("missing"));
            assertThat(session.getItemParameters("missing")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Observable outputs")
    class ObservableOutputs {

        @Test
        @DisplayName("Should store the recorded difficulty with every response")
        void shouldStoreRecordedDifficulty() {
            AssessmentItem first = session.start();
            session.recordResponseAndAdvance(first.id(), false, TEN_SECONDS);

            RecordedResponse response = session.getResponses().get(0);

            assertEquals("comprehension-medium", response.itemId());
            assertFalse(response.correct());
            assertEquals(0.0, response.itemDifficulty());
            assertEquals(TEN_SECONDS, response.timeTaken());
        }

        @Test
        @DisplayName("Should compute SE at the current theta over all responses")
        void shouldComputeStandardError() {
            AssessmentItem first = session.start();
            session.recordResponseAndAdvance(first.id(), false, TEN_SECONDS);

            double expected = 1.0 / Math.sqrt(RaschModel.information(-0.2, 0.0));

            assertEquals(expected, session.getStandardError(), 1e-12);
            assertFalse(session.hasConverged());
        }

        @Test
        @DisplayName("Should keep theta equal to a replay of the history")
        void shouldMatchReplayedTrajectory() {
            AssessmentItem item = session.start();
            boolean correct = true;
            while (item != null) {
                item = session.recordResponseAndAdvance(item.id(), correct, TEN_SECONDS).orElse(null);
                correct = !correct;
            }

            List<Double> trajectory = session.getThetaTrajectory();

            assertEquals(3, trajectory.size());
            assertEquals(session.getTheta(), trajectory.get(trajectory.size() - 1), 1e-15);
        }

        @Test
        @DisplayName("Should summarise accuracy, breakdowns and average time")
        void shouldBuildStatistics() {
            AssessmentItem first = session.start();
            AssessmentItem second = session.recordResponseAndAdvance(first.id(), false, Duration.ofSeconds(10)).orElseThrow();
            AssessmentItem third = session.recordResponseAndAdvance(second.id(), true, Duration.ofSeconds(20)).orElseThrow();
            session.recordResponseAndAdvance(third.id(), false, Duration.ofSeconds(30));

            SessionStatistics stats = session.getStatistics();

            assertEquals(3, stats.totalResponses());
            assertEquals(1, stats.correctCount());
            assertEquals(2, stats.incorrectCount());
            assertEquals(33, stats.accuracyPercent());
            assertEquals(Duration.ofSeconds(20), stats.averageResponseTime());
            assertEquals(session.getTheta(), stats.theta());
            assertEquals(AbilityLevel.fromTheta(session.getTheta()), stats.abilityLevel());

            assertEquals(new LevelTally(1, 1), stats.cognitiveLevelBreakdown().get(CognitiveLevel.RECALL));
            assertEquals(new LevelTally(1, 0), stats.cognitiveLevelBreakdown().get(CognitiveLevel.COMPREHENSION));
            assertEquals(new LevelTally(1, 0), stats.cognitiveLevelBreakdown().get(CognitiveLevel.APPLICATION));
            assertEquals(new LevelTally(1, 1), stats.difficultyBreakdown().get(DifficultyLabel.EASY));
            assertEquals(new LevelTally(1, 0), stats.difficultyBreakdown().get(DifficultyLabel.MEDIUM));
            assertEquals(new LevelTally(1, 0), stats.difficultyBreakdown().get(DifficultyLabel.HARD));
        }

        @Test
        @DisplayName("Should report zeroed statistics before any response")
        void shouldReportEmptyStatistics() {
            SessionStatistics stats = session.getStatistics();

            assertEquals(0, stats.totalResponses());
            assertEquals(0, stats.accuracyPercent());
            assertEquals(Duration.ZERO, stats.averageResponseTime());
            assertEquals(AbilityLevel.AVERAGE, stats.abilityLevel());
            assertThat(stats.cognitiveLevelBreakdown()).hasSize(3).allSatisfy((level, tally) -> assertEquals(LevelTally.EMPTY, tally));
            assertThat(stats.difficultyBreakdown()).hasSize(3);
        }

        @Test
        @DisplayName("Should expose item parameters and predicted success")
        void shouldExposeParametersAndPrediction() {
            assertThat(session.getItemParameters("application-hard"))
                    .map(ItemParameters::difficulty)
                    .contains(2.0);

            assertEquals(0.5, session.predictSuccess("comprehension-medium"), 1e-15);
            assertEquals(RaschModel.probabilityCorrect(0.0, -2.0), session.predictSuccess("recall-easy"), 1e-15);
        }

        @Test
        @DisplayName("Should include the full trajectory in the snapshot")
        void shouldBuildSnapshot() {
            AssessmentItem first = session.start();
            session.recordResponseAndAdvance(first.id(), false, TEN_SECONDS);

            SessionSnapshot snapshot = session.snapshot();

            assertEquals(session.getSessionId(), snapshot.sessionId());
            assertEquals(SessionStatus.IN_PROGRESS, snapshot.status());
            assertThat(snapshot.thetaTrajectory()).containsExactly(session.getTheta());
            assertEquals(session.getStandardError(), snapshot.standardError(), 1e-15);
            assertEquals(AbilityLevel.AVERAGE, snapshot.abilityLevel());
            assertThrows(UnsupportedOperationException.class, () -> snapshot.responses().clear());
        }
    }
}
