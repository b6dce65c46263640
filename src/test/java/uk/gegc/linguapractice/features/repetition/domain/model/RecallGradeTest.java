package uk.gegc.linguapractice.features.repetition.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.linguapractice.shared.exception.ValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecallGradeTest {

    @Test
    @DisplayName("of maps every value in 0..5 to its grade")
    void ofMapsValues() {
        for (int value = 0; value <= 5; value++) {
            assertThat(RecallGrade.of(value).getSm2Value()).isEqualTo(value);
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 6, 42})
    @DisplayName("of rejects values outside 0..5")
    void ofRejectsOutOfRange(int value) {
        assertThatThrownBy(() -> RecallGrade.of(value))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("between 0 and 5")
                .extracting("field").isEqualTo("grade");
    }

    @Test
    @DisplayName("grades below 3 are lapses")
    void lapseBoundary() {
        assertThat(RecallGrade.WRONG_FAMILIAR.isLapse()).isTrue();
        assertThat(RecallGrade.HARD.isLapse()).isFalse();
    }

    @Test
    @DisplayName("correctness maps to 4 and 2")
    void fromCorrectness() {
        assertThat(RecallGrade.fromCorrectness(true).getSm2Value()).isEqualTo(4);
        assertThat(RecallGrade.fromCorrectness(false).getSm2Value()).isEqualTo(2);
    }
}
