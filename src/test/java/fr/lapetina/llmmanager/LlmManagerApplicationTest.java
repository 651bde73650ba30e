package fr.lapetina.llmmanager;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LlmManagerApplicationTest {

    @Test
    void shouldUseDefaultPromptWithoutArguments() {
        assertThat(LlmManagerApplication.promptFrom(new String[0]))
                .isEqualTo("Please tell me what you are called.");
        assertThat(LlmManagerApplication.promptFrom(new String[]{"config.yaml"}))
                .isEqualTo("Please tell me what you are called.");
    }

    @Test
    void shouldJoinArgumentsAfterConfigPath() {
        assertThat(LlmManagerApplication.promptFrom(new String[]{"config.yaml", "Who", "are", "you?"}))
                .isEqualTo("Who are you?");
    }
}
