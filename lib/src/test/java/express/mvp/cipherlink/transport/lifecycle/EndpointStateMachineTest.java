package express.mvp.cipherlink.transport.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Unit tests for {@link EndpointStateMachine}.
 */
class EndpointStateMachineTest {

    private EndpointStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new EndpointStateMachine("test:1.0");
    }

    @Test
    @DisplayName("Starts UNBOUND")
    void initialState() {
        assertEquals(EndpointState.UNBOUND, machine.getState());
        assertEquals("test:1.0", machine.getEndpointId());
        assertTrue(machine.toString().contains("test:1.0"));
    }

    // ==================== Transition Tests ====================

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("Server path: bind, accept, hand off, listen again")
        void serverPath() {
            assertTrue(machine.transitionTo(EndpointState.LISTENING));
            assertTrue(machine.transitionTo(EndpointState.ACCEPTING));
            assertTrue(machine.transitionTo(EndpointState.ESTABLISHED));
            assertTrue(machine.transitionTo(EndpointState.LISTENING));
            assertTrue(machine.transitionTo(EndpointState.CLOSED));
        }

        @Test
        @DisplayName("Client path: connect then establish")
        void clientPath() {
            assertTrue(machine.transitionTo(EndpointState.CONNECTING));
            assertTrue(machine.transitionTo(EndpointState.ESTABLISHED));
            assertTrue(machine.transitionTo(EndpointState.CONNECTING));
        }

        @Test
        @DisplayName("Invalid transition leaves state untouched")
        void invalidTransition() {
            assertFalse(machine.transitionTo(EndpointState.ESTABLISHED));
            assertEquals(EndpointState.UNBOUND, machine.getState());
        }

        @Test
        @DisplayName("Self transitions are rejected")
        void selfTransition() {
            assertFalse(machine.transitionTo(EndpointState.UNBOUND));
        }

        @Test
        @DisplayName("FAILED may only move to CLOSED")
        void failedOnlyCloses() {
            assertTrue(machine.transitionTo(EndpointState.FAILED));
            assertFalse(machine.transitionTo(EndpointState.LISTENING));
            assertFalse(machine.transitionTo(EndpointState.CONNECTING));
            assertTrue(machine.transitionTo(EndpointState.CLOSED));
        }

        @ParameterizedTest
        @EnumSource(EndpointState.class)
        @DisplayName("Nothing leaves CLOSED")
        void closedIsFinal(EndpointState target) {
            machine.transitionTo(EndpointState.CLOSED);
            assertFalse(machine.transitionTo(target));
            assertTrue(EndpointStateMachine.getValidTransitions(EndpointState.CLOSED).isEmpty());
        }

        @Test
        @DisplayName("transitionFrom requires the expected current state")
        void transitionFrom() {
            assertFalse(machine.transitionFrom(EndpointState.LISTENING, EndpointState.ACCEPTING));
            assertTrue(machine.transitionFrom(EndpointState.UNBOUND, EndpointState.LISTENING));
            assertEquals(EndpointState.LISTENING, machine.getState());
        }

        @Test
        @DisplayName("getValidTransitions returns a copy")
        void validTransitionsCopy() {
            EndpointStateMachine.getValidTransitions(EndpointState.UNBOUND).clear();
            assertTrue(EndpointStateMachine.isValidTransition(
                    EndpointState.UNBOUND, EndpointState.LISTENING));
        }
    }

    // ==================== State Tests ====================

    @Test
    @DisplayName("Terminal and listening flags")
    void stateFlags() {
        assertTrue(EndpointState.FAILED.isTerminal());
        assertTrue(EndpointState.CLOSED.isTerminal());
        assertFalse(EndpointState.ESTABLISHED.isTerminal());
        assertTrue(EndpointState.LISTENING.isListening());
        assertTrue(EndpointState.ACCEPTING.isListening());
        assertFalse(EndpointState.CONNECTING.isListening());
        assertEquals("Accepting", EndpointState.ACCEPTING.toString());
    }

    // ==================== Listener Tests ====================

    @Nested
    @DisplayName("Listeners")
    class Listeners {

        @Test
        @DisplayName("Listeners see previous, current and cause")
        void notified() {
            List<String> events = new ArrayList<>();
            Throwable failure = new IllegalStateException("bind");
            machine.addListener((prev, cur, cause) ->
                    events.add(prev.name() + "->" + cur.name() + ":" + cause));

            machine.transitionTo(EndpointState.LISTENING);
            machine.transitionTo(EndpointState.FAILED, failure);

            assertEquals(List.of("UNBOUND->LISTENING:null",
                    "LISTENING->FAILED:" + failure), events);
        }

        @Test
        @DisplayName("A throwing listener does not stop the transition or other listeners")
        void throwingListener() {
            AtomicInteger calls = new AtomicInteger();
            machine.addListener((prev, cur, cause) -> {
                throw new RuntimeException("boom");
            });
            machine.addListener((prev, cur, cause) -> calls.incrementAndGet());

            assertTrue(machine.transitionTo(EndpointState.CONNECTING));
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("Removed listeners are not notified")
        void removed() {
            AtomicInteger calls = new AtomicInteger();
            EndpointStateListener listener = (prev, cur, cause) -> calls.incrementAndGet();
            machine.addListener(listener);
            assertTrue(machine.removeListener(listener));
            machine.transitionTo(EndpointState.LISTENING);
            assertEquals(0, calls.get());
        }
    }

    // ==================== Concurrency Tests ====================

    @Test
    @DisplayName("Exactly one racing thread wins a transition")
    void concurrentTransition() throws InterruptedException {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                executor.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (machine.transitionFrom(EndpointState.UNBOUND, EndpointState.LISTENING)) {
                        winners.incrementAndGet();
                    }
                });
            }
            start.countDown();
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
        assertEquals(1, winners.get());
    }
}
