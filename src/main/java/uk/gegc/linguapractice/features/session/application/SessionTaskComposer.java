package uk.gegc.linguapractice.features.session.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.repetition.application.ReviewQueueSelector;
import uk.gegc.linguapractice.features.task.domain.model.Task;
import uk.gegc.linguapractice.features.task.domain.repository.TaskRepository;
import uk.gegc.linguapractice.shared.config.PracticeProperties;

import java.time.Instant;
import java.util.*;

/**
 * Chooses the tasks of a new session: due reviews first, up to the configured review share of
 * the target, then random tasks from the session's learning paths.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionTaskComposer {

    private final ReviewQueueSelector reviewQueueSelector;
    private final TaskRepository taskRepository;
    private final PracticeProperties properties;

    /**
     * Only due reviews whose task belongs to one of the session's learning paths are taken; a
     * learner's due reviews from other paths are left out of the session and stay due.
     */
    public List<UUID> compose(UUID learnerId, SessionConfiguration configuration, Instant now) {
        int target = configuration.targetCount();
        Set<UUID> learningPaths = new HashSet<>(configuration.learningPathIds());
        LinkedHashSet<UUID> selected = new LinkedHashSet<>();

        if (configuration.includeReview()) {
            int reviewSlots = (int) Math.ceil(target * properties.getReviewShare());
            List<Task> dueTasks = reviewQueueSelector.hydrate(reviewQueueSelector.getDue(learnerId, now));
            for (Task task : dueTasks) {
                if (selected.size() >= reviewSlots) {
                    break;
                }
                if (learningPaths.contains(task.learningPathId())) {
                    selected.add(task.id());
                }
            }
        }
        int reviewCount = selected.size();

        int remaining = target - selected.size();
        if (remaining > 0) {
            taskRepository.findRandom(remaining, learningPaths, configuration.difficultyFilter(), List.copyOf(selected))
                    .forEach(task -> selected.add(task.id()));
        }

        log.debug("Composed {} tasks for learner {} ({} review, {} new, target {})",
                selected.size(), learnerId, reviewCount, selected.size() - reviewCount, target);
        return List.copyOf(selected);
    }
}
