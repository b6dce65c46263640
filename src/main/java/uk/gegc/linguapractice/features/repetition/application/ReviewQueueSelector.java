package uk.gegc.linguapractice.features.repetition.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.repetition.domain.model.DailyReviewLoad;
import uk.gegc.linguapractice.features.repetition.domain.model.SpacedRepetitionItem;
import uk.gegc.linguapractice.features.repetition.domain.repository.SpacedRepetitionItemRepository;
import uk.gegc.linguapractice.features.task.domain.model.Task;
import uk.gegc.linguapractice.features.task.domain.repository.TaskRepository;
import uk.gegc.linguapractice.shared.config.PracticeProperties;
import uk.gegc.linguapractice.shared.exception.ValidationException;
import uk.gegc.linguapractice.shared.util.DateUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds prioritised review lists and day-by-day review load projections for a learner.
 * Reads only; nothing here writes scheduling state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReviewQueueSelector {

    private final SpacedRepetitionItemRepository itemRepository;
    private final TaskRepository taskRepository;
    private final PracticeProperties properties;
    private final DateUtils dateUtils;

    /**
     * All items due at {@code now}, in review priority order.
     */
    public List<SpacedRepetitionItem> getDue(UUID learnerId, Instant now) {
        List<SpacedRepetitionItem> due = new ArrayList<>(itemRepository.findDue(learnerId, now));
        due.sort(ReviewPriority.ORDER);
        return due;
    }

    /**
     * Tasks of the first {@code count} due items in priority order. Items whose task has been
     * removed from the catalogue are skipped without backfilling from lower-priority items, so
     * fewer than {@code count} tasks may come back.
     */
    public List<Task> getNextTasks(UUID learnerId, int count, Instant now) {
        if (count < 1) {
            throw new ValidationException("Count must be at least 1", "count", count);
        }
        List<SpacedRepetitionItem> due = getDue(learnerId, now);
        return hydrate(due.subList(0, Math.min(count, due.size())));
    }

    /**
     * Tasks of the given items, in the items' order, fetched in a single batch.
     */
    public List<Task> hydrate(List<SpacedRepetitionItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<UUID> taskIds = items.stream().map(SpacedRepetitionItem::taskId).toList();
        Map<UUID, Task> byId = taskRepository.findAllById(taskIds).stream()
                .collect(Collectors.toMap(Task::id, Function.identity(), (a, b) -> a));

        List<Task> tasks = new ArrayList<>(taskIds.size());
        for (UUID taskId : taskIds) {
            Task task = byId.get(taskId);
            if (task == null) {
                log.debug("Skipping scheduled task {} which no longer exists", taskId);
                continue;
            }
            tasks.add(task);
        }
        return tasks;
    }

    /**
     * Review load for today and the following {@code days - 1} calendar days. Each day counts the
     * items whose next review falls on that day; items already overdue before today are not
     * included. Untimed items are assumed to take the configured default review time.
     */
    public List<DailyReviewLoad> getReviewSchedule(UUID learnerId, int days) {
        if (days < 1 || days > properties.getMaxScheduleDays()) {
            throw new ValidationException(
                    "Days must be between 1 and " + properties.getMaxScheduleDays(), "days", days);
        }
        LocalDate today = dateUtils.today();
        LocalDate lastDay = today.plusDays(days - 1L);

        List<SpacedRepetitionItem> items = itemRepository.findByNextReviewBetween(
                learnerId, dateUtils.startOfDay(today), dateUtils.endOfDay(lastDay));

        Map<LocalDate, List<SpacedRepetitionItem>> byDay = items.stream()
                .collect(Collectors.groupingBy(item -> dateUtils.toLocalDate(item.schedule().nextReview())));

        List<DailyReviewLoad> schedule = new ArrayList<>(days);
        for (int offset = 0; offset < days; offset++) {
            LocalDate date = today.plusDays(offset);
            List<SpacedRepetitionItem> dayItems = byDay.getOrDefault(date, List.of());
            double totalMs = dayItems.stream().mapToDouble(this::estimatedTimeMs).sum();
            schedule.add(new DailyReviewLoad(date, dayItems.size(), Math.round(totalMs / 1000.0)));
        }
        return schedule;
    }

    private double estimatedTimeMs(SpacedRepetitionItem item) {
        double averageTime = item.performance().averageTime();
        return averageTime > 0 ? averageTime : properties.getDefaultReviewTimeMs();
    }
}
