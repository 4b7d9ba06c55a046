package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.FailurePolicy;
import me.golemcore.memory.domain.model.MemoryOperation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationGuardTest {

    @Test
    void readPathsDegradeAndWritePathsPropagate() {
        assertEquals(FailurePolicy.DEGRADE, MemoryOperation.SEARCH.failurePolicy());
        assertEquals(FailurePolicy.DEGRADE, MemoryOperation.LIST_ALL.failurePolicy());
        assertEquals(FailurePolicy.DEGRADE, MemoryOperation.REFORMULATE.failurePolicy());
        assertEquals(FailurePolicy.PROPAGATE, MemoryOperation.INSERT.failurePolicy());
        assertEquals(FailurePolicy.PROPAGATE, MemoryOperation.CLEAR.failurePolicy());
        assertEquals(FailurePolicy.PROPAGATE, MemoryOperation.EXTRACT.failurePolicy());
        assertEquals(FailurePolicy.PROPAGATE, MemoryOperation.ROTATE.failurePolicy());
    }

    @Test
    void degradingOperationReturnsFallback() {
        List<String> result = OperationGuard.execute(MemoryOperation.SEARCH, () -> {
            throw new IllegalStateException("backend down");
        }, List.of());

        assertEquals(List.of(), result);
    }

    @Test
    void propagatingOperationRethrowsSameException() {
        IllegalStateException failure = new IllegalStateException("backend down");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> OperationGuard.execute(MemoryOperation.INSERT, () -> {
                    throw failure;
                }));
        assertSame(failure, thrown);
    }

    @Test
    void successfulActionResultIsReturned() {
        assertEquals("ok", OperationGuard.execute(MemoryOperation.CLEAR, () -> "ok", "fallback"));
    }
}
