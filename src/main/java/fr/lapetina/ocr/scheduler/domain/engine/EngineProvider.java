package fr.lapetina.ocr.scheduler.domain.engine;

import fr.lapetina.ocr.scheduler.domain.model.Device;

/**
 * Constructs engine instances for a named backend.
 */
@FunctionalInterface
public interface EngineProvider {

    /**
     * Builds a ready-to-use engine.
     *
     * @param backend backend name from configuration, e.g. {@code hf} or {@code vllm}
     * @param device  device selected for this load
     * @throws Exception with a human-readable message when the backend cannot start
     */
    InferenceEngine create(String backend, Device device) throws Exception;

    /**
     * Whether the backend tolerates concurrent {@code predict} calls in one process.
     */
    default boolean isConcurrencySafe(String backend) {
        return false;
    }
}
