package fr.lapetina.ocr.scheduler.resource;

import java.util.Optional;

/**
 * Reads accelerator and system memory. Readings are optional: an empty result
 * means the value could not be measured on this host.
 */
public interface MemoryProbe {

    Optional<MemoryInfo> gpuMemory(int gpuIndex);

    Optional<MemoryInfo> systemMemory();
}
