package uk.gegc.linguapractice.features.progress.application;

import uk.gegc.linguapractice.features.progress.domain.model.StreakSummary;

import java.util.UUID;

public interface StreakService {

    StreakSummary getStreak(UUID learnerId);
}
