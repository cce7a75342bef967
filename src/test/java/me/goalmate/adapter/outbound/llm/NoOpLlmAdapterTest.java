package me.goalmate.adapter.outbound.llm;

import me.goalmate.domain.model.LlmRequest;
import me.goalmate.domain.model.LlmResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpLlmAdapterTest {

    private NoOpLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new NoOpLlmAdapter();
    }

    @Test
    void shouldReturnEmptyResponseFromChat() throws Exception {
        CompletableFuture<LlmResponse> future = adapter.chat(LlmRequest.ofPrompt("hello"));

        assertTrue(future.isDone());
        LlmResponse response = future.get();
        assertFalse(response.hasContent());
        assertEquals("none", response.getModel());
        assertEquals(0, response.getUsage().getTotalTokens());
    }

    @Test
    void shouldReportUnavailable() {
        assertFalse(adapter.isAvailable());
        assertEquals("none", adapter.getProviderId());
        assertEquals("none", adapter.getCurrentModel());
    }

    @Test
    void shouldNotThrowWhenInitializeCalled() {
        adapter.initialize();
        assertFalse(adapter.isAvailable());
    }
}
