package uk.gegc.linguapractice.features.task.domain.model;

public enum TaskDifficulty {
    EASY,
    MEDIUM,
    HARD
}
