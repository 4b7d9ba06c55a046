package me.golemcore.memory.adapter.outbound.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.domain.model.Message;
import me.golemcore.memory.domain.model.ModelTier;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String OPENAI = "openai";

    private MemoryProperties properties;
    private ChatModel chatModel;
    private List<String> createdModels;
    private List<Long> backoffs;
    private long now;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        chatModel = mock(ChatModel.class);
        createdModels = new ArrayList<>();
        backoffs = new ArrayList<>();
        now = 0;
        adapter = new Langchain4jAdapter(properties) {
            @Override
            protected ChatModel createModel(String model) {
                createdModels.add(model);
                return chatModel;
            }

            @Override
            protected void sleepBeforeRetry(long backoffMs) {
                backoffs.add(backoffMs);
                now += backoffMs;
            }

            @Override
            protected long currentTimeMillis() {
                return now;
            }
        };
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text))
                .finishReason(FinishReason.STOP)
                .build();
    }

    private static LlmRequest request(ModelTier tier) {
        return LlmRequest.builder()
                .modelTier(tier)
                .systemPrompt("system")
                .messages(List.of(Message.user("hello")))
                .temperature(0.3)
                .maxTokens(100)
                .build();
    }

    // ===== Identity and availability =====

    @Test
    void shouldReturnLangchain4jProviderId() {
        assertEquals("langchain4j", adapter.getProviderId());
    }

    @Test
    void shouldNotBeAvailableWithoutApiKeys() {
        assertFalse(adapter.isAvailable());

        MemoryProperties.ProviderProperties blank = new MemoryProperties.ProviderProperties();
        blank.setApiKey(" ");
        properties.getLlm().getProviders().put(OPENAI, blank);
        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldBeAvailableWhenApiKeyConfigured() {
        MemoryProperties.ProviderProperties openai = new MemoryProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put(OPENAI, openai);

        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldResolveModelByTier() {
        assertEquals("openai/gpt-4o", adapter.getModel(ModelTier.BALANCED));
        assertEquals("openai/gpt-4o-mini", adapter.getModel(ModelTier.FAST));
    }

    // ===== chat =====

    @Test
    void shouldSendRequestParametersAndConvertResponse() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("a query"));

        LlmResponse result = adapter.chat(request(ModelTier.FAST)).get();

        assertEquals("a query", result.getContent());
        assertEquals("openai/gpt-4o-mini", result.getModel());
        assertEquals("STOP", result.getFinishReason());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest sent = captor.getValue();
        assertEquals(0.3, sent.temperature().doubleValue(), 1e-9);
        assertEquals(100, sent.maxOutputTokens().intValue());
        assertEquals(2, sent.messages().size());
    }

    @Test
    void shouldCacheModelPerName() throws Exception {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("ok"));

        adapter.chat(request(ModelTier.BALANCED)).get();
        adapter.chat(request(ModelTier.BALANCED)).get();
        adapter.chat(request(ModelTier.FAST)).get();

        assertEquals(List.of("openai/gpt-4o", "openai/gpt-4o-mini"), createdModels);
    }

    @Test
    void shouldRetryOnRateLimit() throws Exception {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenThrow(new RuntimeException("429 Too Many Requests"))
                .thenReturn(response("after retry"));

        LlmResponse result = adapter.chat(request(ModelTier.BALANCED)).get();

        assertEquals("after retry", result.getContent());
        assertEquals(List.of(5_000L), backoffs);
        verify(chatModel, times(2)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldHonorServerResetSeconds() throws Exception {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenThrow(new RuntimeException("rate_limit: {\"reset_seconds\": 30}"))
                .thenReturn(response("ok"));

        adapter.chat(request(ModelTier.BALANCED)).get();

        assertEquals(List.of(31_000L), backoffs);
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        properties.getLlm().setTimeoutMs(1_000_000);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("429 Too Many Requests"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(request(ModelTier.BALANCED)).get());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(5, backoffs.size());
        verify(chatModel, times(6)).chat(any(ChatRequest.class));
    }

    @Test
    void shouldStopRetryingBeforeTimeoutBudget() {
        when(chatModel.chat(any(ChatRequest.class)))
                .thenThrow(new RateLimitException("Too Many Requests"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(request(ModelTier.BALANCED)).get());

        // 5s + 10s + 20s fit in the default 60s, the next 40s does not
        assertEquals(List.of(5_000L, 10_000L, 20_000L), backoffs);
        verify(chatModel, times(4)).chat(any(ChatRequest.class));
        assertInstanceOf(RateLimitException.class, error.getCause().getCause());
    }

    @Test
    void shouldFailFastOnOtherErrors() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("401 Unauthorized"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.chat(request(ModelTier.BALANCED)).get());

        assertTrue(error.getCause().getMessage().contains("401 Unauthorized"));
        assertTrue(backoffs.isEmpty());
    }

    @Test
    void shouldFailWhenProviderNotConfigured() {
        Langchain4jAdapter real = new Langchain4jAdapter(properties);

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> real.chat(request(ModelTier.BALANCED)).get());

        assertTrue(error.getCause().getMessage().contains("memory.llm.providers.openai.api-key"));
    }

    // ===== convertMessages =====

    @Test
    void shouldConvertRolesInOrder() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("be brief")
                .messages(List.of(
                        Message.system("memories"),
                        Message.user("hi"),
                        Message.builder().role(Message.ROLE_ASSISTANT).content("hello").build(),
                        Message.builder().role("unknown").content("?").build()))
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(5, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(SystemMessage.class, messages.get(1));
        assertInstanceOf(UserMessage.class, messages.get(2));
        assertInstanceOf(AiMessage.class, messages.get(3));
        assertInstanceOf(UserMessage.class, messages.get(4));
    }

    @Test
    void shouldSkipBlankSystemPrompt() {
        LlmRequest request = LlmRequest.builder().messages(List.of(Message.user("hi"))).build();

        assertEquals(1, adapter.convertMessages(request).size());
    }
}
