package fr.lapetina.llmmanager.registry;

import fr.lapetina.llmmanager.domain.exception.DuplicateBackendTypeException;
import fr.lapetina.llmmanager.domain.exception.DuplicateInstanceException;
import fr.lapetina.llmmanager.domain.exception.InstanceNotFoundException;
import fr.lapetina.llmmanager.domain.exception.UnknownBackendTypeException;
import fr.lapetina.llmmanager.domain.model.BackendConfig;
import fr.lapetina.llmmanager.domain.model.Message;
import fr.lapetina.llmmanager.domain.model.ModelInstance;
import fr.lapetina.llmmanager.testing.StubBackends;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstanceRegistryTest {

    private InstanceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InstanceRegistry();
        registry.registerBackendType("Echo", StubBackends.EchoBackend::new);
    }

    @Nested
    @DisplayName("Backend catalog")
    class CatalogTests {

        @Test
        @DisplayName("should list registered types")
        void shouldListRegisteredTypes() {
            registry.registerBackendType("Failing", StubBackends.FailingBackend::new);

            assertThat(registry.listTypes()).containsExactlyInAnyOrder("Echo", "Failing");
            assertThat(registry.hasBackendType("Echo")).isTrue();
        }

        @Test
        @DisplayName("should reject duplicate type name")
        void shouldRejectDuplicateType() {
            assertThatThrownBy(() -> registry.registerBackendType("Echo", StubBackends.EchoBackend::new))
                    .isInstanceOf(DuplicateBackendTypeException.class)
                    .hasMessageContaining("Echo");

            assertThat(registry.listTypes()).containsExactly("Echo");
        }
    }

    @Nested
    @DisplayName("Instances")
    class InstanceTests {

        @Test
        @DisplayName("should instantiate with empty context and own config")
        void shouldInstantiate() {
            BackendConfig config = BackendConfig.of(Map.of("prefix", "X:"));

            ModelInstance instance = registry.instantiate("a", "Echo", config);

            assertThat(instance.getId()).isEqualTo("a");
            assertThat(instance.getTypeName()).isEqualTo("Echo");
            assertThat(instance.getConfig()).isSameAs(config);
            assertThat(instance.contextSize()).isZero();
            assertThat(registry.resolve("a")).isSameAs(instance);
        }

        @Test
        @DisplayName("should fail for unknown type without mutating registry")
        void shouldFailForUnknownType() {
            assertThatThrownBy(() -> registry.instantiate("a", "Missing", BackendConfig.empty()))
                    .isInstanceOf(UnknownBackendTypeException.class)
                    .hasMessageContaining("Missing");

            assertThat(registry.listInstances()).isEmpty();
        }

        @Test
        @DisplayName("should fail for duplicate id without replacing the live instance")
        void shouldFailForDuplicateId() {
            ModelInstance first = registry.instantiate("a", "Echo", BackendConfig.empty());
            first.append(Message.user("keep me"));

            assertThatThrownBy(() -> registry.instantiate("a", "Echo", BackendConfig.empty()))
                    .isInstanceOf(DuplicateInstanceException.class);

            assertThat(registry.resolve("a")).isSameAs(first);
            assertThat(registry.resolve("a").contextSize()).isEqualTo(1);
            assertThat(registry.listInstances()).containsExactly("a");
        }

        @Test
        @DisplayName("should allow id reuse after removal")
        void shouldAllowIdReuseAfterRemoval() {
            ModelInstance first = registry.instantiate("a", "Echo", BackendConfig.empty());
            registry.remove("a");

            ModelInstance second = registry.instantiate("a", "Echo", BackendConfig.empty());

            assertThat(second).isNotSameAs(first);
            assertThat(registry.resolve("a")).isSameAs(second);
        }

        @Test
        @DisplayName("should clear context on removal")
        void shouldClearContextOnRemoval() {
            ModelInstance instance = registry.instantiate("a", "Echo", BackendConfig.empty());
            instance.append(Message.user("hi"));

            assertThat(registry.remove("a")).isTrue();

            assertThat(instance.contextSize()).isZero();
            assertThatThrownBy(() -> registry.resolve("a")).isInstanceOf(InstanceNotFoundException.class);
        }

        @Test
        @DisplayName("should treat removal of unknown id as no-op")
        void shouldIgnoreUnknownRemoval() {
            registry.instantiate("a", "Echo", BackendConfig.empty());

            assertThatCode(() -> registry.remove("nope")).doesNotThrowAnyException();
            assertThatCode(() -> registry.remove(null)).doesNotThrowAnyException();
            assertThat(registry.remove("nope")).isFalse();
            assertThat(registry.listInstances()).containsExactly("a");
        }

        @Test
        @DisplayName("should return snapshots from listing")
        void shouldReturnSnapshots() {
            registry.instantiate("a", "Echo", BackendConfig.empty());
            List<String> ids = registry.listInstances();

            registry.instantiate("b", "Echo", BackendConfig.empty());
            registry.remove("a");

            assertThat(ids).containsExactly("a");
            assertThat(registry.listInstances()).containsExactly("b");
        }

        @Test
        @DisplayName("should keep one live instance per id under concurrent instantiation")
        void shouldKeepIdsUniqueUnderConcurrency() throws InterruptedException {
            int threads = 16;
            AtomicInteger created = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        registry.instantiate("shared", "Echo", BackendConfig.empty());
                        created.incrementAndGet();
                    } catch (DuplicateInstanceException e) {
                        rejected.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            done.await();
            executor.shutdown();

            assertThat(created.get()).isEqualTo(1);
            assertThat(rejected.get()).isEqualTo(threads - 1);
            assertThat(registry.listInstances()).containsExactly("shared");
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("should notify listeners of instance lifecycle")
        void shouldNotifyListeners() {
            List<InstanceRegistry.RegistryEvent> events = new CopyOnWriteArrayList<>();
            registry.addListener(events::add);

            registry.instantiate("a", "Echo", BackendConfig.empty());
            registry.remove("a");
            registry.remove("a");

            assertThat(events).containsExactly(
                    new InstanceRegistry.RegistryEvent(InstanceRegistry.RegistryEvent.Type.INSTANCE_ADDED, "a"),
                    new InstanceRegistry.RegistryEvent(InstanceRegistry.RegistryEvent.Type.INSTANCE_REMOVED, "a")
            );
        }

        @Test
        @DisplayName("should survive a failing listener")
        void shouldSurviveFailingListener() {
            registry.addListener(event -> {
                throw new IllegalStateException("listener failure");
            });

            assertThatCode(() -> registry.instantiate("a", "Echo", BackendConfig.empty()))
                    .doesNotThrowAnyException();
            assertThat(registry.listInstances()).containsExactly("a");
        }
    }
}
