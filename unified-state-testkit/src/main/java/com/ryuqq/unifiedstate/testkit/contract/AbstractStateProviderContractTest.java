package com.ryuqq.unifiedstate.testkit.contract;

import com.ryuqq.unifiedstate.core.exception.StateNotFoundException;
import com.ryuqq.unifiedstate.core.spi.StateProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Abstract base class for {@link StateProvider} Contract Tests.
 *
 * <p>Every provider implementation must satisfy the same observable contract. Subclasses
 * supply a fresh provider and sample values; this class runs the shared scenarios.</p>
 *
 * <p><strong>Contract Scenarios:</strong></p>
 * <ul>
 *   <li>Round trip: setState then getState returns the stored value</li>
 *   <li>Overwrite: a second setState replaces the first</li>
 *   <li>Not found: getState of an unknown ID throws StateNotFoundException</li>
 *   <li>Delete: deleteState removes the value and is idempotent</li>
 *   <li>List: listStates returns a snapshot of stored IDs</li>
 *   <li>Isolation: for {@code Map} documents, neither the caller's map passed to setState nor the
 *       map returned by getState can change the stored value (skipped for other value types)</li>
 *   <li>Concurrency: concurrent writes of distinct IDs are all visible</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryConversationProviderContractTest
 *         extends AbstractStateProviderContractTest&lt;ConversationState&gt; {
 *
 *     {@literal @}Override
 *     protected StateProvider&lt;ConversationState&gt; createProvider() {
 *         return new InMemoryStateProvider&lt;&gt;(StateType.CONVERSATION, ConversationState.class);
 *     }
 *
 *     {@literal @}Override
 *     protected ConversationState sampleValue(String id, int variant) {
 *         return new ConversationState(id, "session-1", ConversationStage.values()[variant % 5], Map.of(), NOW);
 *     }
 * }
 * </pre>
 *
 * @param <T> provider value type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractStateProviderContractTest<T> {

    protected StateProvider<T> provider;

    /**
     * Creates a fresh, empty provider under test.
     *
     * @return provider
     */
    protected abstract StateProvider<T> createProvider();

    /**
     * Creates a sample value to be stored under {@code id}.
     *
     * <p>Different {@code variant} values must produce values that are not equal to each other.</p>
     *
     * @param id state ID the value will be stored under
     * @param variant variant index
     * @return sample value
     */
    protected abstract T sampleValue(String id, int variant);

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUpProvider() {
        provider = createProvider();
    }

    @Test
    void setState_ThenGetState_ReturnsStoredValue() {
        T value = sampleValue("state-1", 0);

        provider.setState("state-1", value);

        assertEquals(value, provider.getState("state-1"));
    }

    @Test
    void setState_Twice_ReplacesPreviousValue() {
        provider.setState("state-1", sampleValue("state-1", 0));
        T replacement = sampleValue("state-1", 1);

        provider.setState("state-1", replacement);

        assertEquals(replacement, provider.getState("state-1"));
        assertEquals(1, provider.listStates().size());
    }

    @Test
    void getState_UnknownId_ThrowsStateNotFound() {
        StateNotFoundException exception = assertThrows(
            StateNotFoundException.class,
            () -> provider.getState("missing")
        );

        assertEquals(provider.stateType(), exception.stateType());
        assertEquals("missing", exception.stateId());
    }

    @Test
    void deleteState_RemovesValueAndIsIdempotent() {
        provider.setState("state-1", sampleValue("state-1", 0));

        provider.deleteState("state-1");
        provider.deleteState("state-1");

        assertThrows(StateNotFoundException.class, () -> provider.getState("state-1"));
        assertFalse(provider.listStates().contains("state-1"));
    }

    @Test
    void listStates_ReturnsEveryStoredId() {
        provider.setState("state-1", sampleValue("state-1", 0));
        provider.setState("state-2", sampleValue("state-2", 1));
        provider.setState("state-3", sampleValue("state-3", 2));

        List<String> ids = provider.listStates();

        assertEquals(3, ids.size());
        assertTrue(ids.containsAll(List.of("state-1", "state-2", "state-3")));
    }

    @Test
    void listStates_ReturnsSnapshotNotLiveView() {
        provider.setState("state-1", sampleValue("state-1", 0));
        List<String> snapshot = provider.listStates();

        provider.setState("state-2", sampleValue("state-2", 1));

        assertEquals(1, snapshot.size());
    }

    @Test
    void setState_CallerMutatesDocumentAfterWrite_StoredValueUnchanged() {
        T sample = sampleValue("state-1", 0);
        assumeTrue(sample instanceof Map, "document providers only");
        Map<Object, Object> document = new LinkedHashMap<>((Map<?, ?>) sample);

        provider.setState("state-1", provider.valueType().cast(document));
        document.put("injected", "after-write");

        assertEquals(sample, provider.getState("state-1"));
    }

    @Test
    void getState_ReturnedDocumentCannotChangeStoredValue() {
        T sample = sampleValue("state-1", 0);
        assumeTrue(sample instanceof Map, "document providers only");
        provider.setState("state-1", provider.valueType().cast(new LinkedHashMap<>((Map<?, ?>) sample)));

        Map<?, ?> read = (Map<?, ?>) provider.getState("state-1");
        boolean readOnly;
        try {
            read.clear();
            readOnly = false;
        } catch (UnsupportedOperationException e) {
            readOnly = true;
        }

        assertEquals(sample, provider.getState("state-1"),
            readOnly ? "read-only document was altered" : "clearing a returned copy altered the stored document");
    }

    @Test
    void valueType_AcceptsSampleValues() {
        assertTrue(provider.valueType().isInstance(sampleValue("state-1", 0)));
    }

    @Test
    void concurrentWrites_DistinctIds_AreAllVisible() throws InterruptedException {
        int threadCount = 8;
        int writesPerThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger failures = new AtomicInteger();

        for (int t = 0; t < threadCount; t++) {
            int thread = t;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < writesPerThread; i++) {
                        String id = "state-" + thread + "-" + i;
                        provider.setState(id, sampleValue(id, i));
                    }
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "writers did not finish in time");
        executor.shutdown();

        assertEquals(0, failures.get());
        List<String> ids = new ArrayList<>(provider.listStates());
        assertEquals(threadCount * writesPerThread, ids.size());
    }
}
