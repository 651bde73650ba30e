package fr.lapetina.llmmanager.domain.backend;

import fr.lapetina.llmmanager.domain.model.BackendConfig;

/**
 * Constructor for one backend type, stored in the registry catalog.
 */
@FunctionalInterface
public interface BackendFactory {

    Backend create(BackendConfig config);
}
