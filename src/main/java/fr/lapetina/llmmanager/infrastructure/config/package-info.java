/**
 * Configuration loading.
 *
 * <p>YAML is parsed with SnakeYAML into {@link fr.lapetina.llmmanager.infrastructure.config.ManagerConfig}.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code secretsFile} - JSON file holding API keys</li>
 *   <li>{@code instances} - model instances created at startup</li>
 *   <li>{@code dispatch} - context policy used by the entry point</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.llmmanager.infrastructure.config;
