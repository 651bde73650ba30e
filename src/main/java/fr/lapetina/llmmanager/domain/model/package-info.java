/**
 * Domain model classes shared by the registry, the dispatcher and the reporter.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.llmmanager.domain.model.Message} - Immutable (role, content) pair</li>
 *   <li>{@link fr.lapetina.llmmanager.domain.model.BackendConfig} - Open key/value backend configuration</li>
 *   <li>{@link fr.lapetina.llmmanager.domain.model.ModelInstance} - Named backend binding with its conversation history</li>
 *   <li>{@link fr.lapetina.llmmanager.domain.model.ErrorType} - Categorized dispatch failures</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>{@code Message} is an immutable record. {@code ModelInstance} and {@code BackendConfig}
 * guard their mutable state with their own monitor and only expose copies of it.
 */
package fr.lapetina.llmmanager.domain.model;
