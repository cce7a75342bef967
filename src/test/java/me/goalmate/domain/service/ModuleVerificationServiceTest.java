package me.goalmate.domain.service;

import me.goalmate.domain.model.Goal;
import me.goalmate.domain.model.GoalMateSession;
import me.goalmate.domain.model.GoalModule;
import me.goalmate.domain.model.VerificationChallenge;
import me.goalmate.domain.model.VerificationOutcome;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ModuleVerificationServiceTest {

    private static final Instant FIXED_INSTANT = Instant.parse("2026-03-10T09:00:00Z");

    private MutableClock clock;
    private GoalMateProperties properties;
    private GoalMateSession session;
    private GoalService goalService;
    private InsightService insightService;
    private ModuleVerificationService service;
    private Goal goal;
    private String moduleId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FIXED_INSTANT);
        properties = new GoalMateProperties();
        session = new GoalMateSession();
        ActivityLogService activityLogService = new ActivityLogService(session, properties);
        LevelingService levelingService = new LevelingService(session, activityLogService, clock);
        HabitService habitService = new HabitService(session, levelingService, activityLogService, properties,
                clock);
        goalService = new GoalService(session, levelingService, habitService, new ProgressProjector(), clock);
        insightService = mock(InsightService.class);
        service = new ModuleVerificationService(goalService, insightService,
                new InFlightRegistry(properties, clock), properties);

        goal = goalService.createGoal("Learn Python", "Coding", null, Goal.GoalKind.LEARNING,
                List.of("Variables", "Loops"));
        moduleId = goal.getModules().get(0).getId();
        when(insightService.askModuleQuestion("Learn Python", "Variables"))
                .thenReturn(CompletableFuture.completedFuture("What is a variable?"));
        when(insightService.askModuleQuestion("Learn Python", "Loops"))
                .thenReturn(CompletableFuture.completedFuture("What does a loop do?"));
    }

    @Test
    void shouldStartDialogWithQuestion() {
        VerificationChallenge challenge = service.start(goal.getId(), moduleId).join();

        assertEquals("What is a variable?", challenge.question());
        assertEquals("Variables", challenge.moduleName());
        assertTrue(service.isInProgress(moduleId));
    }

    @Test
    void shouldRejectSecondDialogForSameModule() {
        service.start(goal.getId(), moduleId).join();

        assertThrows(IllegalStateException.class, () -> service.start(goal.getId(), moduleId));
    }

    @Test
    void shouldRejectUnknownModule() {
        assertThrows(IllegalArgumentException.class, () -> service.start(goal.getId(), "missing"));
    }

    @Test
    void shouldVerifyModuleAfterAcknowledgment() {
        VerificationChallenge challenge = service.start(goal.getId(), moduleId).join();
        when(insightService.acknowledge(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("Great answer!"));

        VerificationOutcome outcome = service.submitAnswer(challenge.ticket(), "  a named value  ").join();

        GoalModule module = firstModule();
        assertTrue(outcome.applied());
        assertEquals("Great answer!", outcome.feedback());
        assertEquals(10, outcome.award().amount());
        assertEquals(50, outcome.progress().percent());
        assertTrue(module.isCompleted());
        assertTrue(module.isVerified());
        assertFalse(service.isInProgress(moduleId));
    }

    @Test
    void shouldRejectBlankAnswer() {
        VerificationChallenge challenge = service.start(goal.getId(), moduleId).join();

        assertThrows(IllegalArgumentException.class, () -> service.submitAnswer(challenge.ticket(), "   "));
    }

    @Test
    void shouldRejectSecondSubmissionWhileFirstIsPending() {
        VerificationChallenge challenge = service.start(goal.getId(), moduleId).join();
        CompletableFuture<String> pending = new CompletableFuture<>();
        when(insightService.acknowledge(anyString(), anyString(), anyString(), anyString())).thenReturn(pending);

        service.submitAnswer(challenge.ticket(), "first");

        assertThrows(IllegalStateException.class, () -> service.submitAnswer(challenge.ticket(), "second"));
    }

    @Test
    void shouldDiscardResultArrivingAfterCancel() {
        VerificationChallenge challenge = service.start(goal.getId(), moduleId).join();
        CompletableFuture<String> pending = new CompletableFuture<>();
        when(insightService.acknowledge(anyString(), anyString(), anyString(), anyString())).thenReturn(pending);

        CompletableFuture<VerificationOutcome> result = service.submitAnswer(challenge.ticket(), "answer");
        service.cancel(challenge.ticket());
        pending.complete("Nice!");

        VerificationOutcome outcome = result.join();
        assertFalse(outcome.applied());
        assertFalse(firstModule().isCompleted());
        assertEquals(0, session.getProfile().getExperience());
    }

    @Test
    void shouldDiscardResultArrivingAfterExpiry() {
        VerificationChallenge challenge = service.start(goal.getId(), moduleId).join();
        CompletableFuture<String> pending = new CompletableFuture<>();
        when(insightService.acknowledge(anyString(), anyString(), anyString(), anyString())).thenReturn(pending);

        CompletableFuture<VerificationOutcome> result = service.submitAnswer(challenge.ticket(), "answer");
        clock.advance(Duration.ofMinutes(11));
        pending.complete("Nice!");

        assertFalse(result.join().applied());
        assertFalse(firstModule().isCompleted());
        assertFalse(service.isInProgress(moduleId));
    }

    @Test
    void shouldNotVerifyWhenTokenReleaseIsLost() {
        InFlightRegistry registry = mock(InFlightRegistry.class);
        when(registry.acquire("module:" + moduleId)).thenReturn("t1");
        when(registry.isCurrent("module:" + moduleId, "t1")).thenReturn(true);
        when(registry.release("module:" + moduleId, "t1")).thenReturn(false);
        when(insightService.acknowledge(anyString(), anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("Nice!"));
        ModuleVerificationService racing = new ModuleVerificationService(goalService, insightService, registry,
                properties);
        racing.start(goal.getId(), moduleId).join();

        VerificationOutcome outcome = racing.submitAnswer("t1", "answer").join();

        assertFalse(outcome.applied());
        assertFalse(firstModule().isCompleted());
        assertEquals(0, session.getProfile().getExperience());
        verify(registry).release("module:" + moduleId, "t1");
    }

    @Test
    void shouldEvictExpiredDialogsWhenStartingAnother() {
        VerificationChallenge abandoned = service.start(goal.getId(), moduleId).join();
        String secondModuleId = goal.getModules().get(1).getId();

        clock.advance(Duration.ofMinutes(11));
        service.start(goal.getId(), secondModuleId).join();

        assertThrows(IllegalArgumentException.class, () -> service.selfComplete(abandoned.ticket()));
        assertFalse(firstModule().isCompleted());
    }

    @Test
    void shouldReplaceExpiredDialogForSameModule() {
        VerificationChallenge abandoned = service.start(goal.getId(), moduleId).join();

        clock.advance(Duration.ofMinutes(11));
        VerificationChallenge fresh = service.start(goal.getId(), moduleId).join();

        assertThrows(IllegalArgumentException.class, () -> service.selfComplete(abandoned.ticket()));
        assertTrue(service.selfComplete(fresh.ticket()).applied());
        assertTrue(firstModule().isCompleted());
    }

    @Test
    void shouldRejectAnswerForCancelledDialog() {
        VerificationChallenge challenge = service.start(goal.getId(), moduleId).join();
        service.cancel(challenge.ticket());

        assertThrows(IllegalArgumentException.class, () -> service.submitAnswer(challenge.ticket(), "answer"));
    }

    @Test
    void shouldSelfCompleteWithoutVerification() {
        VerificationChallenge challenge = service.start(goal.getId(), moduleId).join();

        VerificationOutcome outcome = service.selfComplete(challenge.ticket());

        GoalModule module = firstModule();
        assertTrue(outcome.applied());
        assertTrue(module.isCompleted());
        assertFalse(module.isVerified());
        assertEquals(25, outcome.progress().percent());
        assertFalse(service.isInProgress(moduleId));
    }

    @Test
    void shouldAllowRestartAfterCancel() {
        VerificationChallenge first = service.start(goal.getId(), moduleId).join();
        service.cancel(first.ticket());

        VerificationChallenge second = service.start(goal.getId(), moduleId).join();

        assertFalse(first.ticket().equals(second.ticket()));
        assertThrows(IllegalArgumentException.class, () -> service.selfComplete(first.ticket()));
        when(insightService.acknowledge(any(), any(), any(), any()))
                .thenReturn(CompletableFuture.completedFuture("ok"));
        assertTrue(service.submitAnswer(second.ticket(), "answer").join().applied());
    }

    private GoalModule firstModule() {
        return goalService.getGoal(goal.getId()).orElseThrow().getModules().get(0);
    }

    private static final class MutableClock extends Clock {

        private Instant currentInstant;

        private MutableClock(Instant instant) {
            this.currentInstant = instant;
        }

        void advance(Duration duration) {
            currentInstant = currentInstant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return Clock.fixed(currentInstant, zone);
        }

        @Override
        public Instant instant() {
            return currentInstant;
        }
    }
}
