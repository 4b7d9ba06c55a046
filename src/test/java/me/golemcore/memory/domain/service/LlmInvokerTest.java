package me.golemcore.memory.domain.service;

import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import me.golemcore.memory.adapter.outbound.llm.Langchain4jAdapter;
import me.golemcore.memory.domain.exception.GenerationException;
import me.golemcore.memory.domain.model.GenerationFailureKind;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.domain.model.Message;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmInvokerTest {

    private LlmPort llmPort;
    private MemoryProperties properties;
    private LlmInvoker invoker;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        properties = new MemoryProperties();
        invoker = new LlmInvoker(llmPort, properties);
    }

    @Test
    void returnsTrimmedContent() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("  answer \n").build()));

        assertEquals("answer", invoker.complete(LlmRequest.builder().build()));
    }

    @Test
    void unavailableProviderFails() {
        when(llmPort.isAvailable()).thenReturn(false);

        LlmRequest request = LlmRequest.builder().build();
        assertThrows(GenerationException.class, () -> invoker.complete(request));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void emptyContentIsClassified() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(" ").build()));

        GenerationException error = assertThrows(GenerationException.class,
                () -> invoker.complete(LlmRequest.builder().build()));
        assertEquals(GenerationFailureKind.EMPTY_RESPONSE, error.getKind());
    }

    @Test
    void failedFutureIsClassified() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(
                new IllegalStateException("HTTP 429 Too Many Requests")));

        GenerationException error = assertThrows(GenerationException.class,
                () -> invoker.complete(LlmRequest.builder().build()));
        assertEquals(GenerationFailureKind.RATE_LIMIT, error.getKind());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void synchronousFailureIsWrapped() {
        when(llmPort.chat(any())).thenThrow(new IllegalStateException("401 Unauthorized"));

        GenerationException error = assertThrows(GenerationException.class,
                () -> invoker.complete(LlmRequest.builder().build()));
        assertEquals(GenerationFailureKind.AUTHENTICATION, error.getKind());
    }

    @Test
    void slowResponseTimesOut() {
        properties.getLlm().setTimeoutMs(50);
        when(llmPort.chat(any())).thenReturn(new CompletableFuture<>());

        GenerationException error = assertThrows(GenerationException.class,
                () -> invoker.complete(LlmRequest.builder().build()));
        assertEquals(GenerationFailureKind.TIMEOUT, error.getKind());
    }

    @Test
    void sustainedRateLimitIsReportedAsRateLimit() {
        MemoryProperties.ProviderProperties openai = new MemoryProperties.ProviderProperties();
        openai.setApiKey("sk-test");
        properties.getLlm().getProviders().put("openai", openai);
        ChatModel chatModel = mock(ChatModel.class);
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("Too Many Requests"));
        List<Long> backoffs = new ArrayList<>();
        Langchain4jAdapter adapter = new Langchain4jAdapter(properties) {
            private long now;

            @Override
            protected ChatModel createModel(String model) {
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
        LlmInvoker realInvoker = new LlmInvoker(adapter, properties);

        GenerationException error = assertThrows(GenerationException.class,
                () -> realInvoker.complete(LlmRequest.builder().message(Message.user("hi")).build()));

        assertEquals(GenerationFailureKind.RATE_LIMIT, error.getKind());
        assertTrue(backoffs.stream().mapToLong(Long::longValue).sum() < properties.getLlm().getTimeoutMs());
    }
}
