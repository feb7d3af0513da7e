package io.mockdispatch.core.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryRecordStoreTest {

    private final InMemoryRecordStore store = new InMemoryRecordStore();

    private static ObjectNode record(String id) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", id);
        return node;
    }

    @Test
    void absentCollectionIsEmptyOptional() {
        assertThat(store.get("users")).isEmpty();
        assertThat(store.exists("users")).isFalse();
    }

    @Test
    void emptyCollectionStillExists() {
        store.replace("users", List.of());

        assertThat(store.exists("users")).isTrue();
        assertThat(store.get("users")).hasValueSatisfying(records -> assertThat(records).isEmpty());
    }

    @Test
    void readsAreSnapshots() {
        store.replace("users", List.of(record("1")));

        store.get("users").orElseThrow().get(0).put("name", "changed");
        ObjectNode found = store.findItem("users", "1").orElseThrow();
        found.put("name", "changed too");

        assertThat(store.get("users").orElseThrow().get(0).has("name")).isFalse();
    }

    @Test
    void replaceCopiesInput() {
        List<ObjectNode> input = new ArrayList<>(List.of(record("1")));
        store.replace("users", input);

        input.get(0).put("id", "2");
        input.add(record("3"));

        assertThat(store.get("users").orElseThrow()).hasSize(1);
        assertThat(store.findItem("users", "1")).isPresent();
    }

    @Test
    void appendCreatesCollection() {
        store.append("users", record("1"));
        store.append("users", record("2"));

        assertThat(store.get("users").orElseThrow()).extracting(r -> r.get("id").asText()).containsExactly("1", "2");
    }

    @Test
    void failingMutationLeavesStoreUntouched() {
        store.replace("users", List.of(record("1")));

        assertThatThrownBy(() -> store.update("users", records -> {
                    records.clear();
                    throw new IllegalStateException("boom");
                }))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.update("posts", records -> {
                    throw new IllegalStateException("boom");
                }))
                .isInstanceOf(IllegalStateException.class);

        assertThat(store.get("users").orElseThrow()).hasSize(1);
        assertThat(store.exists("posts")).isFalse();
    }

    @Test
    void clearRemovesCollection() {
        store.replace("users", List.of(record("1")));

        assertThat(store.clear("users")).isTrue();
        assertThat(store.clear("users")).isFalse();
        assertThat(store.exists("users")).isFalse();
    }

    @Test
    void resourceNamesAreSorted() {
        store.replace("posts", List.of());
        store.replace("comments", List.of());

        assertThat(store.resourceNames()).containsExactly("comments", "posts");
        assertThat(store.snapshot()).containsOnlyKeys("comments", "posts");
    }

    @Test
    void concurrentAppendsAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.append("events", record(thread + "-" + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get("events").orElseThrow()).hasSize(threads * perThread);
    }
}
