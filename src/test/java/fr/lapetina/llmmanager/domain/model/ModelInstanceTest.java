package fr.lapetina.llmmanager.domain.model;

import fr.lapetina.llmmanager.testing.StubBackends;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelInstanceTest {

    private ModelInstance instance;

    @BeforeEach
    void setUp() {
        instance = new ModelInstance("a", "Echo", BackendConfig.empty(), new StubBackends.EchoBackend());
    }

    @Test
    @DisplayName("should hand out copies of the context")
    void shouldHandOutCopies() {
        instance.append(Message.user("hi"));

        List<Message> snapshot = instance.snapshotContext();
        snapshot.add(Message.assistant("injected"));

        assertThat(instance.snapshotContext()).containsExactly(Message.user("hi"));
    }

    @Test
    @DisplayName("should reset context")
    void shouldResetContext() {
        instance.appendAll(List.of(Message.user("hi"), Message.assistant("hello")));

        instance.resetContext();

        assertThat(instance.contextSize()).isZero();
    }

    @Test
    @DisplayName("should update configuration in place")
    void shouldUpdateConfiguration() {
        instance.updateConfig(Map.of("model", "b"));

        assertThat(instance.getConfig().get("model")).isEqualTo("b");
    }

    @Test
    @DisplayName("should reject messages without role or content")
    void shouldRejectIncompleteMessages() {
        assertThatThrownBy(() -> new Message(null, "x")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Message("user", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("should keep round pairs adjacent under concurrent appends")
    void shouldKeepRoundPairsAdjacent() throws InterruptedException {
        int threads = 8;
        int rounds = 200;
        CountDownLatch latch = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            int thread = t;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < rounds; i++) {
                        String tag = thread + "-" + i;
                        instance.appendAll(List.of(Message.user(tag), Message.assistant(tag)));
                    }
                } finally {
                    latch.countDown();
                }
            });
        }

        latch.await();
        executor.shutdown();

        List<Message> context = instance.snapshotContext();
        assertThat(context).hasSize(threads * rounds * 2);
        for (int i = 0; i < context.size(); i += 2) {
            assertThat(context.get(i).role()).isEqualTo(Message.USER);
            assertThat(context.get(i + 1).role()).isEqualTo(Message.ASSISTANT);
            assertThat(context.get(i + 1).content()).isEqualTo(context.get(i).content());
        }
    }
}
