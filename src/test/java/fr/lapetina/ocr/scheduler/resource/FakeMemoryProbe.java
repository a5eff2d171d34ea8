package fr.lapetina.ocr.scheduler.resource;

import java.util.Optional;

/**
 * Memory probe returning whatever the test sets.
 */
public final class FakeMemoryProbe implements MemoryProbe {

    private volatile MemoryInfo gpu;
    private volatile MemoryInfo system;

    public static FakeMemoryProbe cpuOnly() {
        FakeMemoryProbe probe = new FakeMemoryProbe();
        probe.setSystem(64.0, 128.0);
        return probe;
    }

    public static FakeMemoryProbe withGpu(double freeGb, double totalGb) {
        FakeMemoryProbe probe = cpuOnly();
        probe.setGpu(freeGb, totalGb);
        return probe;
    }

    public void setGpu(double freeGb, double totalGb) {
        this.gpu = new MemoryInfo(freeGb, totalGb);
    }

    public void setSystem(double freeGb, double totalGb) {
        this.system = new MemoryInfo(freeGb, totalGb);
    }

    @Override
    public Optional<MemoryInfo> gpuMemory(int gpuIndex) {
        return Optional.ofNullable(gpu);
    }

    @Override
    public Optional<MemoryInfo> systemMemory() {
        return Optional.ofNullable(system);
    }
}
