package uk.gegc.linguapractice.features.repetition.domain.model;

import lombok.Getter;
import uk.gegc.linguapractice.shared.exception.ValidationException;

/**
 * SM-2 recall quality, 0 (complete blackout) to 5 (perfect response).
 */
@Getter
public enum RecallGrade {
    BLACKOUT(0),
    WRONG_REMEMBERED(1),
    WRONG_FAMILIAR(2),
    HARD(3),
    GOOD(4),
    PERFECT(5);

    public static final RecallGrade DEFAULT_CORRECT = GOOD;
    public static final RecallGrade DEFAULT_INCORRECT = WRONG_FAMILIAR;

    private final int sm2Value;

    RecallGrade(int sm2Value) {
        this.sm2Value = sm2Value;
    }

    public boolean isLapse() {
        return sm2Value < 3;
    }

    public static RecallGrade of(int value) {
        for (RecallGrade grade : values()) {
            if (grade.sm2Value == value) {
                return grade;
            }
        }
        throw new ValidationException("Grade must be between 0 and 5", "grade", value);
    }

    public static RecallGrade fromCorrectness(boolean correct) {
        return correct ? DEFAULT_CORRECT : DEFAULT_INCORRECT;
    }
}
