/**
 * LLM Manager - registry and concurrent dispatcher for interchangeable conversational-model backends.
 *
 * <p>Named model instances are created from a catalog of backend types, prompted one at a
 * time or all at once, and keep their own conversation history.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmmanager.registry.InstanceRegistry} - Backend catalog and live instances</li>
 *   <li>{@link fr.lapetina.llmmanager.dispatch.Dispatcher} - Single and fan-out prompt rounds</li>
 *   <li>{@link fr.lapetina.llmmanager.report.HistoryReporter} - Conversation transcripts</li>
 *   <li>{@link fr.lapetina.llmmanager.ManagerFactory} - Wiring from YAML configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * InstanceRegistry registry = new InstanceRegistry();
 * BackendTypes.registerBuiltIns(registry);
 * registry.instantiate("local", BackendTypes.OLLAMA, BackendConfig.of(Map.of("model", "llama3")));
 *
 * Dispatcher dispatcher = new Dispatcher(registry, new MetricsRegistry());
 * String answer = dispatcher.dispatchOne("local", "Hello!", DispatchOptions.conversational()).join();
 * }</pre>
 *
 * @see fr.lapetina.llmmanager.ManagerFactory
 * @see fr.lapetina.llmmanager.dispatch.Dispatcher
 */
package fr.lapetina.llmmanager;
