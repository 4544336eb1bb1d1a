package com.example.orchestrator.rpc;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ControlLoopTest {
    @Test
    void appliesMessagesInPostOrder() throws Exception {
        List<Integer> applied = new CopyOnWriteArrayList<>();
        try (ControlLoop loop = new ControlLoop("test-control")) {
            for (int i = 0; i < 100; i++) {
                int value = i;
                loop.post("append", () -> applied.add(value));
            }
            loop.flush().get(5, TimeUnit.SECONDS);
        }

        assertEquals(100, applied.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(i, applied.get(i));
        }
    }

    @Test
    void failingActionDoesNotStopTheLoop() throws Exception {
        try (ControlLoop loop = new ControlLoop("test-control")) {
            loop.post("explode", () -> {
                throw new IllegalStateException("boom");
            });

            assertEquals("still running", loop.call("answer", () -> "still running").get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void callCompletesExceptionallyWhenSupplierThrows() throws Exception {
        try (ControlLoop loop = new ControlLoop("test-control")) {
            CompletionException error = assertThrows(CompletionException.class,
                    () -> loop.call("fail", () -> {
                        throw new IllegalArgumentException("bad request");
                    }).join());

            assertInstanceOf(IllegalArgumentException.class, error.getCause());
        }
    }

    @Test
    void runsActionsOnTheLoopThread() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        try (ControlLoop loop = new ControlLoop("test-control")) {
            loop.execute(() -> {
                if (loop.inLoop()) {
                    latch.countDown();
                }
            });

            assertTrue(latch.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void rejectsMessagesAfterClose() {
        ControlLoop loop = new ControlLoop("test-control");
        loop.close();

        assertTrue(loop.isClosed());
        assertThrows(RejectedExecutionException.class, () -> loop.post("late", () -> {
        }));
        CompletionException error = assertThrows(CompletionException.class, () -> loop.flush().join());
        assertInstanceOf(RejectedExecutionException.class, error.getCause());
    }
}
