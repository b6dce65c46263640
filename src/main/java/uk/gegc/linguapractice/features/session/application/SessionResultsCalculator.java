package uk.gegc.linguapractice.features.session.application;

import org.springframework.stereotype.Component;
import uk.gegc.linguapractice.features.answer.domain.model.AnswerRecord;
import uk.gegc.linguapractice.features.session.domain.model.PracticeSession;
import uk.gegc.linguapractice.features.task.domain.model.Task;

import java.util.*;

/**
 * Derives the results of a session from its counters, its answers and the answered tasks.
 */
@Component
public class SessionResultsCalculator {

    static final int MAX_IMPROVEMENT_AREAS = 5;

    public PracticeSession.Results calculate(PracticeSession session, List<AnswerRecord> answers, Map<UUID, Task> tasks) {
        int completed = session.execution().completedCount();
        int accuracy = completed == 0
                ? 0
                : (int) Math.round(session.execution().correctCount() * 100.0 / completed);

        double averageTime = answers.stream()
                .mapToInt(AnswerRecord::timeSpent)
                .average()
                .orElse(0);

        Map<String, Integer> difficultyDistribution = new TreeMap<>();
        Map<String, Integer> missedTags = new HashMap<>();
        for (AnswerRecord answer : answers) {
            Task task = tasks.get(answer.taskId());
            if (task == null) {
                continue;
            }
            difficultyDistribution.merge(task.difficulty().name(), 1, Integer::sum);
            if (!answer.correct()) {
                task.tags().forEach(tag -> missedTags.merge(tag, 1, Integer::sum));
            }
        }

        List<String> improvementAreas = missedTags.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(MAX_IMPROVEMENT_AREAS)
                .map(Map.Entry::getKey)
                .toList();

        return new PracticeSession.Results(accuracy, averageTime, difficultyDistribution, improvementAreas);
    }
}
