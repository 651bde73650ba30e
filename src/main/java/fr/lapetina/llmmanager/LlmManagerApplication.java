package fr.lapetina.llmmanager;

import fr.lapetina.llmmanager.dispatch.DispatchResult;
import fr.lapetina.llmmanager.dispatch.FanOutResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code LlmManagerApplication [config.yaml] [prompt...]}. Sends the prompt
 * to every configured instance, prints each conversation history and removes
 * the instances.
 */
public class LlmManagerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmManagerApplication.class);

    static final String DEFAULT_PROMPT = "Please tell me what you are called.";

    private final ManagerFactory factory;
    private final PrintStream out;

    public LlmManagerApplication(ManagerFactory factory, PrintStream out) {
        this.factory = factory;
        this.out = out;
    }

    /**
     * Fans the prompt out to all configured instances and prints the transcripts.
     */
    public FanOutResult run(String prompt) {
        log.info("Prompting {} instances", factory.getConfiguredInstanceIds().size());

        FanOutResult result = factory.getDispatcher()
                .dispatchMany(factory.getConfiguredInstanceIds(), prompt, factory.getDispatchOptions())
                .join();

        for (DispatchResult entry : result.results()) {
            if (entry.isSuccess()) {
                log.info("Response received: instanceId={}, latencyMs={}",
                        entry.instanceId(), entry.latency().toMillis());
            } else {
                log.warn("Instance failed: instanceId={}, errorType={}, error={}",
                        entry.instanceId(), entry.errorType(), entry.errorMessage());
            }
        }

        out.println();
        out.print(factory.getHistoryReporter().formatAllTranscripts());
        return result;
    }

    @Override
    public void close() {
        factory.close();
    }

    static String promptFrom(String[] args) {
        if (args.length < 2) {
            return DEFAULT_PROMPT;
        }
        return String.join(" ", Arrays.copyOfRange(args, 1, args.length));
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try (LlmManagerApplication app = new LlmManagerApplication(ManagerFactory.create(configPath), System.out)) {
            app.run(promptFrom(args));
        } catch (Exception e) {
            log.error("LLM manager failed", e);
            System.exit(1);
        }
    }
}
