package me.goalmate.adapter.inbound.web.controller;

import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.GoalMateSession;
import me.goalmate.domain.model.ModuleSuggestion;
import me.goalmate.domain.service.ActivityLogService;
import me.goalmate.domain.service.GoalService;
import me.goalmate.domain.service.HabitService;
import me.goalmate.domain.service.LevelingService;
import me.goalmate.domain.service.ModuleSuggestionService;
import me.goalmate.domain.service.ProgressProjector;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GoalsControllerTest {

    private GoalService goalService;
    private ModuleSuggestionService moduleSuggestionService;
    private GoalsController controller;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-10T09:00:00Z"), ZoneOffset.UTC);
        GoalMateProperties properties = new GoalMateProperties();
        GoalMateSession session = new GoalMateSession();
        ActivityLogService activityLogService = new ActivityLogService(session, properties);
        LevelingService levelingService = new LevelingService(session, activityLogService, clock);
        HabitService habitService = new HabitService(session, levelingService, activityLogService, properties,
                clock);
        ProgressProjector progressProjector = new ProgressProjector();
        goalService = new GoalService(session, levelingService, habitService, progressProjector, clock);
        moduleSuggestionService = mock(ModuleSuggestionService.class);
        controller = new GoalsController(goalService, moduleSuggestionService, progressProjector, properties);
    }

    @Test
    void shouldCreateLearningGoal() {
        GoalsController.CreateGoalRequest request = new GoalsController.CreateGoalRequest("Learn Python", "Coding",
                null, Goal.GoalKind.LEARNING, List.of("Variables", "Loops"));

        StepVerifier.create(controller.createGoal(request))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.CREATED, resp.getStatusCode());
                    GoalsController.GoalDto body = resp.getBody();
                    assertNotNull(body);
                    assertEquals("LEARNING", body.kind());
                    assertEquals(2, body.modules().size());
                    assertEquals(0, body.progressPercent());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownGoal() {
        StepVerifier.create(controller.getGoal("missing"))
                .assertNext(resp -> assertEquals(HttpStatus.NOT_FOUND, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldAppendGeneratedModules() {
        Goal goal = goalService.createGoal("Learn Python", "Coding", null, Goal.GoalKind.LEARNING, List.of());
        when(moduleSuggestionService.suggestModules("Learn Python", null))
                .thenReturn(CompletableFuture.completedFuture(List.of(
                        new ModuleSuggestion("Variables", "Store data."),
                        new ModuleSuggestion("Loops", "Repeat work."))));

        StepVerifier.create(controller.generateModules(goal.getId()))
                .assertNext(resp -> {
                    List<GoalsController.ModuleDto> modules = resp.getBody().modules();
                    assertEquals(2, modules.size());
                    assertEquals("GENERATED", modules.get(0).source());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectModuleGenerationForGenericGoal() {
        Goal goal = goalService.createGoal("Run 5k", "Fitness", null, Goal.GoalKind.GENERIC, List.of());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.generateModules(goal.getId()));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void shouldSelfCompleteModuleAndReportProgress() {
        Goal goal = goalService.createGoal("Learn Python", "Coding", null, Goal.GoalKind.LEARNING,
                List.of("Variables", "Loops"));
        String moduleId = goal.getModules().get(0).getId();

        StepVerifier.create(controller.selfCompleteModule(goal.getId(), moduleId))
                .assertNext(resp -> {
                    GoalsController.ModuleActionResponse body = resp.getBody();
                    assertNotNull(body);
                    assertEquals(25, body.goal().progressPercent());
                    assertEquals(0, body.xpAwarded());
                })
                .verifyComplete();
    }

    @Test
    void shouldUpdateGenericProgress() {
        Goal goal = goalService.createGoal("Run 5k", "Fitness", null, Goal.GoalKind.GENERIC, List.of());

        StepVerifier.create(controller.updateProgress(goal.getId(),
                new GoalsController.UpdateProgressRequest(40, "Ran 2k")))
                .assertNext(resp -> {
                    assertEquals(40, resp.getBody().progressPercent());
                    assertEquals("Ran 2k", resp.getBody().progressText());
                })
                .verifyComplete();
    }

    @Test
    void shouldRequirePercentForProgressUpdate() {
        assertThrows(ResponseStatusException.class, () -> controller.updateProgress("g1",
                new GoalsController.UpdateProgressRequest(null, "text")));
    }

    @Test
    void shouldCreateAndLinkHabitByName() {
        Goal goal = goalService.createGoal("Learn Python", "Coding", null, Goal.GoalKind.LEARNING, List.of());

        StepVerifier.create(controller.linkHabit(goal.getId(),
                new GoalsController.LinkHabitRequest(null, "Code daily")))
                .assertNext(resp -> assertNotNull(resp.getBody().linkedHabitId()))
                .verifyComplete();

        StepVerifier.create(controller.getLinkedHabit(goal.getId()))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals("Code daily", resp.getBody().name());
                })
                .verifyComplete();
    }

    @Test
    void shouldRequireHabitIdOrName() {
        Goal goal = goalService.createGoal("Learn Python", "Coding", null, Goal.GoalKind.LEARNING, List.of());

        assertThrows(ResponseStatusException.class,
                () -> controller.linkHabit(goal.getId(), new GoalsController.LinkHabitRequest(" ", null)));
    }

    @Test
    void shouldFinalizeGoal() {
        Goal goal = goalService.createGoal("Run 5k", "Fitness", null, Goal.GoalKind.GENERIC, List.of());
        goalService.updateGenericProgress(goal.getId(), 100, "Done");

        StepVerifier.create(controller.finalizeGoal(goal.getId()))
                .assertNext(resp -> {
                    assertTrue(resp.getBody().finalized());
                    assertEquals(100, resp.getBody().progressPercent());
                })
                .verifyComplete();
    }
}
