package fr.lapetina.ocr.scheduler.resource;

import fr.lapetina.ocr.scheduler.domain.engine.InferenceEngine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped right to use the engine, obtained from {@link ResourceManager#inferenceContext}.
 *
 * Must be closed on every path; closing twice is a no-op.
 * <pre>{@code
 * try (InferenceContext ctx = resourceManager.inferenceContext(timeout)) {
 *     ctx.engine().predict(input, options);
 * }
 * }</pre>
 */
public final class InferenceContext implements AutoCloseable {

    private final ResourceManager owner;
    private final InferenceEngine engine;
    private final boolean serialized;
    private final AtomicBoolean released = new AtomicBoolean(false);

    InferenceContext(ResourceManager owner, InferenceEngine engine, boolean serialized) {
        this.owner = owner;
        this.engine = engine;
        this.serialized = serialized;
    }

    public InferenceEngine engine() {
        return engine;
    }

    /**
     * Whether this context holds the global inference lock.
     */
    public boolean isSerialized() {
        return serialized;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            owner.release(this);
        }
    }
}
