package uk.gegc.linguapractice.features.repetition.domain.model;

public record RepetitionStatistics(
        long totalItems,
        long dueNow,
        long graduated,
        double averageInterval,
        double averageAccuracy
) {
    public static RepetitionStatistics empty() {
        return new RepetitionStatistics(0, 0, 0, 0, 0);
    }
}
