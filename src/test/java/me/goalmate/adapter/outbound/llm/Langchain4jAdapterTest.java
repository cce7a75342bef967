package me.goalmate.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import me.goalmate.domain.model.LlmRequest;
import me.goalmate.domain.model.LlmResponse;
import me.goalmate.domain.model.Message;
import me.goalmate.infrastructure.config.GoalMateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String OPENAI = "openai";
    private static final String KEY = "key";

    private GoalMateProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new GoalMateProperties();
        adapter = new Langchain4jAdapter(properties);
    }

    @Test
    void shouldExtractProviderFromModel() {
        assertEquals("anthropic", Langchain4jAdapter.getProvider("anthropic/claude-sonnet-4"));
        assertEquals(OPENAI, Langchain4jAdapter.getProvider("gpt-4o-mini"));
        assertEquals(OPENAI, Langchain4jAdapter.getProvider(null));
    }

    @Test
    void shouldStripProviderPrefix() {
        assertEquals("gpt-4o-mini", Langchain4jAdapter.stripProviderPrefix("openai/gpt-4o-mini"));
        assertEquals("gpt-4o-mini", Langchain4jAdapter.stripProviderPrefix("gpt-4o-mini"));
    }

    @Test
    void shouldDetectRateLimitInCauseChain() {
        RuntimeException wrapped = new RuntimeException("outer",
                new IllegalStateException("HTTP 429 Too Many Requests"));

        assertTrue(Langchain4jAdapter.isRateLimitError(wrapped));
        assertFalse(Langchain4jAdapter.isRateLimitError(new IllegalStateException("bad request")));
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldBeAvailableWhenModelProviderHasApiKey() {
        GoalMateProperties.ProviderProperties provider = new GoalMateProperties.ProviderProperties();
        provider.setApiKey(KEY);
        properties.getLlm().getLangchain4j().getProviders().put(OPENAI, provider);

        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldIgnoreKeyOfOtherProvider() {
        GoalMateProperties.ProviderProperties provider = new GoalMateProperties.ProviderProperties();
        provider.setApiKey(KEY);
        properties.getLlm().getLangchain4j().getProviders().put("anthropic", provider);

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldConvertMessagesWithSystemPrompt() {
        LlmRequest request = LlmRequest.builder().systemPrompt("Be brief").build();
        request.addMessage(Message.user("Hi"));
        request.addMessage(new Message("assistant", "Hello"));
        request.addMessage(new Message("narrator", "Once upon a time"));

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        assertInstanceOf(AiMessage.class, messages.get(2));
        assertInstanceOf(UserMessage.class, messages.get(3));
    }

    @Test
    void shouldReturnConvertedResponseFromChatModel() throws Exception {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder()
                .aiMessage(AiMessage.from("What is a variable?"))
                .tokenUsage(new TokenUsage(12, 5))
                .finishReason(FinishReason.STOP)
                .build());
        injectModel(chatModel);

        LlmResponse response = adapter.chat(LlmRequest.ofPrompt("Ask me")).get();

        assertEquals("What is a variable?", response.getContent());
        assertEquals(17, response.getUsage().getTotalTokens());
        assertEquals("STOP", response.getFinishReason());
    }

    @Test
    void shouldFailWithoutRetryOnOtherErrors() {
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(anyList())).thenThrow(new IllegalArgumentException("invalid model"));
        injectModel(chatModel);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.ofPrompt("Ask me")).get());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    void shouldFailChatWhenProviderNotConfigured() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.ofPrompt("Ask me")).get());

        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    private void injectModel(ChatModel chatModel) {
        ReflectionTestUtils.setField(adapter, "chatModel", chatModel);
        ReflectionTestUtils.setField(adapter, "currentModel", "openai/gpt-4o-mini");
        ReflectionTestUtils.setField(adapter, "initialized", true);
    }
}
