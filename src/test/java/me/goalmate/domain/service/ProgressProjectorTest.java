package me.goalmate.domain.service;

import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.GoalModule;
import me.goalmate.domain.model.GoalProgress;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ProgressProjectorTest {

    private final ProgressProjector projector = new ProgressProjector();

    @Test
    void shouldCountVerifiedFullAndSelfCompletedHalf() {
        Goal goal = learningGoal(verified(), selfCompleted(), pending(), pending());

        GoalProgress progress = projector.project(goal);

        assertEquals(38, progress.percent());
        assertEquals("1 Verified, 1 Self-Completed / 4 Total Modules", progress.text());
    }

    @Test
    void shouldRoundHalfUp() {
        // 1 half of 4 modules = 12.5%
        assertEquals(13, projector.project(learningGoal(selfCompleted(), pending(), pending(), pending()))
                .percent());
        // 1 of 3 = 33.33%
        assertEquals(33, projector.project(learningGoal(verified(), pending(), pending())).percent());
        // 2 of 3 = 66.67%
        assertEquals(67, projector.project(learningGoal(verified(), verified(), pending())).percent());
    }

    @Test
    void shouldReportHundredOnlyWhenAllModulesVerified() {
        assertEquals(100, projector.project(learningGoal(verified(), verified())).percent());
        assertEquals(75, projector.project(learningGoal(verified(), selfCompleted())).percent());
        assertEquals(50, projector.project(learningGoal(selfCompleted(), selfCompleted())).percent());
    }

    @Test
    void shouldReportNoModules() {
        GoalProgress progress = projector.project(learningGoal());

        assertEquals(0, progress.percent());
        assertEquals(ProgressProjector.NO_MODULES_TEXT, progress.text());
    }

    @Test
    void shouldUseStoredFieldsForGenericGoal() {
        Goal goal = Goal.builder().kind(Goal.GoalKind.GENERIC).progressPercent(40).statusText("On track").build();

        GoalProgress progress = projector.project(goal);

        assertEquals(40, progress.percent());
        assertEquals("On track", progress.text());
    }

    @Test
    void shouldDefaultGenericTextFromPercent() {
        Goal done = Goal.builder().kind(Goal.GoalKind.GENERIC).progressPercent(100).build();
        Goal started = Goal.builder().kind(Goal.GoalKind.GENERIC).progressPercent(20).build();

        assertEquals(ProgressProjector.COMPLETED_TEXT, projector.project(done).text());
        assertEquals(ProgressProjector.NOT_STARTED_TEXT, projector.project(started).text());
    }

    @Test
    void shouldReportFinalizedGoalAsCompleteForEitherKind() {
        Goal learning = learningGoal(selfCompleted(), selfCompleted());
        learning.setFinalized(true);
        Goal generic = Goal.builder().kind(Goal.GoalKind.GENERIC).progressPercent(100).finalized(true).build();

        GoalProgress expected = new GoalProgress(100, ProgressProjector.FINALIZED_TEXT);
        assertEquals(expected, projector.project(learning));
        assertEquals(expected, projector.project(generic));
    }

    @Test
    void shouldReflectModuleChangesBetweenReads() {
        GoalModule module = pending();
        Goal goal = learningGoal(module);
        assertEquals(0, projector.project(goal).percent());

        module.setStatus(GoalModule.ModuleStatus.COMPLETED);
        module.setVerified(true);

        assertEquals(100, projector.project(goal).percent());
    }

    private static Goal learningGoal(GoalModule... modules) {
        return Goal.builder()
                .kind(Goal.GoalKind.LEARNING)
                .modules(new ArrayList<>(List.of(modules)))
                .build();
    }

    private static GoalModule pending() {
        return GoalModule.builder().name("pending").build();
    }

    private static GoalModule selfCompleted() {
        return GoalModule.builder().name("self").status(GoalModule.ModuleStatus.COMPLETED).build();
    }

    private static GoalModule verified() {
        return GoalModule.builder().name("verified").status(GoalModule.ModuleStatus.COMPLETED).verified(true)
                .build();
    }
}
