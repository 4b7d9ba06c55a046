package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.GenerationException;
import me.golemcore.memory.domain.model.GenerationFailureKind;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.ModelTier;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class QueryReformulationServiceTest {

    private static final String INPUT = "what should I eat tonight?";

    private LlmInvoker llmInvoker;
    private QueryReformulationService service;

    @BeforeEach
    void setUp() {
        llmInvoker = mock(LlmInvoker.class);
        service = new QueryReformulationService(llmInvoker, new MemoryProperties());
    }

    @Test
    void returnsGeneratedQuery() {
        when(llmInvoker.complete(any())).thenReturn("user food preferences dinner");

        assertEquals("user food preferences dinner", service.reformulate(INPUT, List.of()));
    }

    @Test
    void usesFastTierWithShortOutput() {
        when(llmInvoker.complete(any())).thenReturn("query");

        service.reformulate(INPUT, List.of());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmInvoker).complete(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals(ModelTier.FAST, request.getModelTier());
        assertEquals(0.3, request.getTemperature(), 1e-9);
        assertEquals(100, request.getMaxTokens());
        String prompt = request.getMessages().get(0).getContent();
        assertTrue(prompt.contains("No recent context"));
        assertTrue(prompt.contains("User input: \"" + INPUT + "\""));
        assertTrue(prompt.contains("under 20 words"));
    }

    @Test
    void onlyLastFourTurnsAreUsedAsContext() {
        when(llmInvoker.complete(any())).thenReturn("query");
        List<Turn> turns = List.of(
                Turn.user("turn one"),
                Turn.assistant("turn two"),
                Turn.user("turn three"),
                Turn.assistant("turn four"),
                Turn.user("turn five"),
                Turn.assistant("turn six"));

        service.reformulate(INPUT, turns);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmInvoker).complete(captor.capture());
        String prompt = captor.getValue().getMessages().get(0).getContent();
        assertFalse(prompt.contains("turn one"));
        assertFalse(prompt.contains("turn two"));
        assertTrue(prompt.contains("user: turn three\nassistant: turn four\nuser: turn five\nassistant: turn six"));
    }

    @Test
    void fallsBackToInputWhenGenerationFails() {
        when(llmInvoker.complete(any()))
                .thenThrow(new GenerationException(GenerationFailureKind.OTHER, "service down"));

        assertEquals(INPUT, service.reformulate(INPUT, List.of(Turn.user("hello"))));
    }

    @Test
    void fallsBackToInputOnTimeout() {
        when(llmInvoker.complete(any()))
                .thenThrow(new GenerationException(GenerationFailureKind.TIMEOUT, "timed out"));

        assertEquals(INPUT, service.reformulate(INPUT, List.of()));
    }

    @Test
    void stripsSurroundingQuotes() {
        when(llmInvoker.complete(any())).thenReturn("\"marathon training plan\"");

        assertEquals("marathon training plan", service.reformulate(INPUT, List.of()));
    }

    @Test
    void rejectsBlankInput() {
        assertThrows(IllegalArgumentException.class, () -> service.reformulate("  ", List.of()));
        assertThrows(IllegalArgumentException.class, () -> service.reformulate(null, List.of()));
        verifyNoInteractions(llmInvoker);
    }
}
