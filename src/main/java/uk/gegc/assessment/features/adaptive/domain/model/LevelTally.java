package uk.gegc.assessment.features.adaptive.domain.model;

public record LevelTally(int attempted, int correct) {

    public static final LevelTally EMPTY = new LevelTally(0, 0);

    public LevelTally add(boolean wasCorrect) {
        return new LevelTally(attempted + 1, wasCorrect ? correct + 1 : correct);
    }
}
