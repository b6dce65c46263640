package uk.gegc.linguapractice.shared.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.practice")
public class PracticeProperties {

    /**
     * Share of a session's target count filled with due review tasks when review is included.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double reviewShare = 0.3;

    @Min(1)
    private int maxTargetCount = 50;

    /**
     * Time assumed for an item that has never been timed, used by review load projections.
     */
    @Min(0)
    private long defaultReviewTimeMs = 30_000L;

    @Min(1)
    private int maxScheduleDays = 90;

    /**
     * Repetition count from which an item counts as graduated.
     */
    @Min(1)
    private int graduationThreshold = 2;

    @Min(1)
    private int maxWriteRetries = 3;

    @Min(0)
    private long retryBackoffMs = 50L;

    @Min(1)
    private int streakLookbackDays = 365;
}
