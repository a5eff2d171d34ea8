package fr.lapetina.ocr.scheduler.resource;

/**
 * One memory reading in gigabytes.
 *
 * @param freeGb  free (GPU) or available (system) memory
 * @param totalGb total memory
 */
public record MemoryInfo(double freeGb, double totalGb) {
}
