package uk.gegc.linguapractice.features.progress.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.linguapractice.features.progress.application.StreakProjector;
import uk.gegc.linguapractice.features.progress.application.StreakService;
import uk.gegc.linguapractice.features.progress.domain.model.StreakSummary;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;
import uk.gegc.linguapractice.features.session.domain.repository.PracticeSessionRepository;
import uk.gegc.linguapractice.shared.config.PracticeProperties;
import uk.gegc.linguapractice.shared.util.DateUtils;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class StreakServiceImpl implements StreakService {

    private final PracticeSessionRepository sessionRepository;
    private final StreakProjector streakProjector;
    private final PracticeProperties properties;
    private final DateUtils dateUtils;

    @Override
    @Transactional(readOnly = true)
    public StreakSummary getStreak(UUID learnerId) {
        LocalDate today = dateUtils.today();
        LocalDate firstDay = today.minusDays(properties.getStreakLookbackDays());
        List<PracticeSession> completed = sessionRepository.findCompletedBetween(
                learnerId, dateUtils.startOfDay(firstDay), dateUtils.endOfDay(today));
        return streakProjector.project(completed, today, dateUtils.getZone());
    }
}
