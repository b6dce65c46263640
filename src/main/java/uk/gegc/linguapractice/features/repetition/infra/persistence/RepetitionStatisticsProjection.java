package uk.gegc.linguapractice.features.repetition.infra.persistence;

public interface RepetitionStatisticsProjection {
    Long getTotalItems();

    Long getDueNow();

    Long getGraduated();

    Double getAverageInterval();

    Double getAverageAccuracy();
}
