package me.goalmate.adapter.inbound.web.controller;

import me.goalmate.domain.model.ExperienceAward;
import me.goalmate.domain.model.GoalProgress;
import me.goalmate.domain.model.VerificationChallenge;
import me.goalmate.domain.model.VerificationOutcome;
import me.goalmate.domain.service.ModuleVerificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VerificationControllerTest {

    private static final String TICKET = "ticket-1";

    private ModuleVerificationService verificationService;
    private VerificationController controller;

    @BeforeEach
    void setUp() {
        verificationService = mock(ModuleVerificationService.class);
        controller = new VerificationController(verificationService);
    }

    @Test
    void shouldStartVerification() {
        when(verificationService.start("g1", "m1")).thenReturn(CompletableFuture.completedFuture(
                new VerificationChallenge(TICKET, "g1", "m1", "Learn Python", "Variables", "What is a variable?")));

        StepVerifier.create(controller.start(new VerificationController.StartRequest("g1", "m1")))
                .assertNext(resp -> {
                    assertEquals(TICKET, resp.getBody().ticket());
                    assertEquals("What is a variable?", resp.getBody().question());
                })
                .verifyComplete();
    }

    @Test
    void shouldRequireGoalAndModule() {
        assertThrows(ResponseStatusException.class,
                () -> controller.start(new VerificationController.StartRequest("g1", null)));
    }

    @Test
    void shouldReturnAppliedOutcome() {
        ExperienceAward award = new ExperienceAward(10, 10, 1, 1, List.of());
        when(verificationService.submitAnswer(TICKET, "a named value")).thenReturn(CompletableFuture
                .completedFuture(new VerificationOutcome(true, "Nice!", new GoalProgress(50, "1/2"), award)));

        StepVerifier.create(controller.submitAnswer(TICKET,
                new VerificationController.AnswerRequest("a named value")))
                .assertNext(resp -> {
                    VerificationController.OutcomeResponse body = resp.getBody();
                    assertTrue(body.applied());
                    assertEquals(50, body.progressPercent());
                    assertEquals(10, body.xpAwarded());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnDiscardedOutcomeWithoutProgress() {
        when(verificationService.submitAnswer(TICKET, "late")).thenReturn(CompletableFuture
                .completedFuture(VerificationOutcome.discarded("Nice!")));

        StepVerifier.create(controller.submitAnswer(TICKET, new VerificationController.AnswerRequest("late")))
                .assertNext(resp -> {
                    assertFalse(resp.getBody().applied());
                    assertNull(resp.getBody().progressPercent());
                    assertEquals(0, resp.getBody().xpAwarded());
                })
                .verifyComplete();
    }

    @Test
    void shouldCancelWithNoContent() {
        StepVerifier.create(controller.cancel(TICKET))
                .assertNext(resp -> assertEquals(HttpStatus.NO_CONTENT, resp.getStatusCode()))
                .verifyComplete();
        verify(verificationService).cancel(TICKET);
    }
}
