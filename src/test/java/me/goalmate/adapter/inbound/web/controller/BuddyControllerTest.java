package me.goalmate.adapter.inbound.web.controller;

import me.goalmate.domain.service.InsightService;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BuddyControllerTest {

    private InsightService insightService;
    private BuddyController controller;

    @BeforeEach
    void setUp() {
        insightService = mock(InsightService.class);
        controller = new BuddyController(insightService, new GoalMateProperties());
    }

    @Test
    void shouldReturnBuddyName() {
        StepVerifier.create(controller.getBuddy())
                .assertNext(resp -> assertEquals("Alex Taylor", resp.getBody().name()))
                .verifyComplete();
    }

    @Test
    void shouldReplyAsBuddy() {
        when(insightService.chatReply("Alex Taylor", "I finished a module"))
                .thenReturn(CompletableFuture.completedFuture("Way to go!"));

        StepVerifier.create(controller.sendMessage(new BuddyController.MessageRequest("  I finished a module ")))
                .assertNext(resp -> {
                    assertEquals("Alex Taylor", resp.getBody().from());
                    assertEquals("Way to go!", resp.getBody().text());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectBlankMessage() {
        assertThrows(ResponseStatusException.class,
                () -> controller.sendMessage(new BuddyController.MessageRequest(" ")));
    }
}
