package fr.lapetina.llmmanager.integration;

import fr.lapetina.llmmanager.LlmManagerApplication;
import fr.lapetina.llmmanager.dispatch.FanOutResult;
import fr.lapetina.llmmanager.domain.exception.DuplicateInstanceException;
import fr.lapetina.llmmanager.domain.model.BackendConfig;
import fr.lapetina.llmmanager.domain.model.ErrorType;
import fr.lapetina.llmmanager.infrastructure.http.BackendTypes;
import fr.lapetina.llmmanager.registry.InstanceRegistry.RegistryEvent;
import fr.lapetina.llmmanager.report.HistoryReporter.HistoryLine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests wiring the manager from test-config.yaml.
 */
class ManagerIntegrationTest {

    private TestManagerFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestManagerFactory.create();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    @Test
    @DisplayName("should register built-in and test types and create configured instances")
    void shouldWireConfiguredInstances() {
        assertThat(factory.getInstanceRegistry().listTypes())
                .containsAll(BackendTypes.names())
                .contains(TestManagerFactory.ECHO, TestManagerFactory.FAILING);
        assertThat(factory.getConfiguredInstanceIds()).containsExactly("echo-1", "echo-2", "broken");
        assertThat(factory.getInstanceRegistry().listInstances())
                .containsExactlyInAnyOrder("echo-1", "echo-2", "broken");
        assertThat(factory.getMetricsRegistry().getLiveInstances()).isEqualTo(3);
    }

    @Test
    @DisplayName("should fan out with configured policy and keep histories per instance")
    void shouldFanOutWithConfiguredPolicy() throws Exception {
        FanOutResult result = factory.getDispatcher()
                .dispatchMany(factory.getConfiguredInstanceIds(), "hello", factory.getDispatchOptions())
                .get(5, TimeUnit.SECONDS);

        assertThat(result.asDisplayMap())
                .containsEntry("echo-1", "ECHO:hello")
                .containsEntry("echo-2", "SECOND:hello")
                .containsEntry("broken", "ERROR: backend unavailable");
        assertThat(result.get("broken").orElseThrow().errorType()).isEqualTo(ErrorType.BACKEND_ERROR);

        assertThat(factory.getHistoryReporter().render("echo-2")).containsExactly(
                new HistoryLine("USER", "hello"),
                new HistoryLine("ASSISTANT", "SECOND:hello")
        );
        assertThat(factory.getHistoryReporter().render("broken")).isEmpty();
    }

    @Test
    @DisplayName("should continue a conversation on a single instance")
    void shouldContinueConversation() throws Exception {
        factory.getDispatcher().dispatchMany(factory.getConfiguredInstanceIds(), "first",
                factory.getDispatchOptions()).get(5, TimeUnit.SECONDS);

        String second = factory.getDispatcher()
                .dispatchOne("echo-1", "What?", factory.getDispatchOptions())
                .get(5, TimeUnit.SECONDS);

        assertThat(second).isEqualTo("ECHO:What?");
        assertThat(factory.getHistoryReporter().render("echo-1")).hasSize(4);
        assertThat(factory.getHistoryReporter().render("echo-2")).hasSize(2);
    }

    @Test
    @DisplayName("should reject a second instance under a configured id")
    void shouldRejectDuplicateConfiguredId() {
        assertThatThrownBy(() -> factory.getInstanceRegistry()
                .instantiate("echo-1", TestManagerFactory.ECHO, BackendConfig.empty()))
                .isInstanceOf(DuplicateInstanceException.class);
    }

    @Test
    @DisplayName("should print transcripts and release instances when the application closes")
    void shouldRunApplication() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        TestManagerFactory appFactory = TestManagerFactory.create();
        List<String> removed = new CopyOnWriteArrayList<>();
        appFactory.getInstanceRegistry().addListener(event -> {
            if (event.type() == RegistryEvent.Type.INSTANCE_REMOVED) {
                removed.add(event.name());
            }
        });
        FanOutResult result;
        try (LlmManagerApplication app = new LlmManagerApplication(appFactory, out)) {
            result = app.run("Please tell me what you are called.");
        }

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(result.size()).isEqualTo(3);
        assertThat(printed)
                .contains("--- CONVERSATION HISTORY FOR 'echo-1' ---")
                .contains("ASSISTANT: ECHO:Please tell me what you are called.")
                .contains("--- END CONVERSATION ---");
        assertThat(appFactory.getInstanceRegistry().listInstances()).isEmpty();
        assertThat(removed).containsExactlyInAnyOrder("echo-1", "echo-2", "broken");
    }
}
