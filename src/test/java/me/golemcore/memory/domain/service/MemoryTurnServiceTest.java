package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.GenerationException;
import me.golemcore.memory.domain.model.ChunkMetadata;
import me.golemcore.memory.domain.model.ConversationSession;
import me.golemcore.memory.domain.model.GenerationFailureKind;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.Message;
import me.golemcore.memory.domain.model.ModelTier;
import me.golemcore.memory.domain.model.SearchResult;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.domain.model.TurnResult;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MemoryTurnServiceTest {

    private static final ChunkMetadata METADATA = new ChunkMetadata("2026-01-01T12:00:00Z",
            FactExtractionService.SOURCE, null, 10);

    private QueryReformulationService reformulationService;
    private VectorMemoryStore memoryStore;
    private ConversationSummarizer summarizer;
    private LlmInvoker llmInvoker;
    private MemoryTurnService service;
    private ConversationSession session;

    @BeforeEach
    void setUp() {
        reformulationService = mock(QueryReformulationService.class);
        memoryStore = mock(VectorMemoryStore.class);
        summarizer = mock(ConversationSummarizer.class);
        llmInvoker = mock(LlmInvoker.class);
        MemoryProperties properties = new MemoryProperties();
        ConversationBufferService bufferService = new ConversationBufferService(summarizer, properties);
        service = new MemoryTurnService(reformulationService, memoryStore, bufferService, llmInvoker, properties);
        session = new ConversationSession("test");

        when(reformulationService.reformulate(anyString(), anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(memoryStore.search(anyString(), eq(3))).thenReturn(List.of());
    }

    // ===== Happy path =====

    @Test
    void recordsExchangeInBuffer() {
        when(llmInvoker.complete(any())).thenReturn("Nice to meet you!");

        TurnResult result = service.handleTurn(session, "Hi, I'm Ana");

        assertEquals("Nice to meet you!", result.reply());
        assertFalse(result.rotated());
        assertFalse(result.hasRotationError());
        assertEquals(List.of(Turn.user("Hi, I'm Ana"), Turn.assistant("Nice to meet you!")), session.getTurns());
    }

    @Test
    void searchesWithReformulatedQueryAndInjectsMemories() {
        when(reformulationService.reformulate(eq("where do I live?"), anyList())).thenReturn("user home city");
        List<SearchResult> memories = List.of(
                new SearchResult("User lives in Tokyo.", METADATA, 0.1),
                new SearchResult("User is Brazilian.", METADATA, 0.2));
        when(memoryStore.search("user home city", 3)).thenReturn(memories);
        when(llmInvoker.complete(any())).thenReturn("You live in Tokyo.");
        session.addTurn(Turn.user("hello"));
        session.addTurn(Turn.assistant("hi"));

        TurnResult result = service.handleTurn(session, "where do I live?");

        assertEquals("user home city", result.searchQuery());
        assertEquals(memories, result.memories());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmInvoker).complete(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals(ModelTier.BALANCED, request.getModelTier());
        assertEquals(MemoryTurnService.ASSISTANT_PROMPT, request.getSystemPrompt());
        List<Message> messages = request.getMessages();
        assertEquals(4, messages.size());
        assertEquals(Message.ROLE_SYSTEM, messages.get(0).getRole());
        assertEquals(MemoryTurnService.MEMORIES_PREFIX + "User lives in Tokyo. | User is Brazilian.",
                messages.get(0).getContent());
        assertEquals("hello", messages.get(1).getContent());
        assertEquals("hi", messages.get(2).getContent());
        assertEquals("where do I live?", messages.get(3).getContent());
    }

    @Test
    void omitsMemoryMessageWhenNothingRecalled() {
        when(llmInvoker.complete(any())).thenReturn("ok");

        service.handleTurn(session, "hello");

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmInvoker).complete(captor.capture());
        assertEquals(1, captor.getValue().getMessages().size());
    }

    // ===== Rotation =====

    @Test
    void rotatesWhenWindowFills() {
        when(llmInvoker.complete(any())).thenReturn("reply");
        when(summarizer.summarize(anyList())).thenReturn("User chatted about several things.");

        TurnResult last = null;
        for (int i = 0; i < 4; i++) {
            last = service.handleTurn(session, "message " + i);
        }

        assertTrue(last.rotated());
        assertEquals("User chatted about several things.", session.getRollingSummary());
        assertEquals(1, session.size());
    }

    @Test
    void rotationFailureIsReportedAndExchangeKept() {
        when(llmInvoker.complete(any())).thenReturn("reply");
        when(summarizer.summarize(anyList()))
                .thenThrow(new GenerationException(GenerationFailureKind.TIMEOUT, "timed out"));
        for (int i = 0; i < 3; i++) {
            session.addTurn(Turn.user("m" + i));
            session.addTurn(Turn.assistant("r" + i));
        }

        TurnResult result = service.handleTurn(session, "one more");

        assertEquals("reply", result.reply());
        assertFalse(result.rotated());
        assertTrue(result.hasRotationError());
        assertEquals(GenerationFailureKind.TIMEOUT, result.rotationError().getKind());
        assertEquals(8, session.size());
    }

    // ===== Failures =====

    @Test
    void replyFailureLeavesSessionUnchanged() {
        when(llmInvoker.complete(any()))
                .thenThrow(new GenerationException(GenerationFailureKind.AUTHENTICATION, "401"));

        assertThrows(GenerationException.class, () -> service.handleTurn(session, "hello"));
        assertTrue(session.getTurns().isEmpty());
    }

    @Test
    void blankInputIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> service.handleTurn(session, " "));
        verifyNoInteractions(llmInvoker);
    }
}
