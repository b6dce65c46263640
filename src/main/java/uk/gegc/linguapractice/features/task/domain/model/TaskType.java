package uk.gegc.linguapractice.features.task.domain.model;

public enum TaskType {
    MULTIPLE_CHOICE,
    CLOZE_DELETION,
    TRUE_FALSE,
    ORDERING,
    MATCHING,
    MULTIPLE_SELECT,
    SLIDER,
    WORD_SCRAMBLE,
    FLASHCARD,
    ERROR_DETECTION
}
