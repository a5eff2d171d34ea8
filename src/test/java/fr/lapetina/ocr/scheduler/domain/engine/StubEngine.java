package fr.lapetina.ocr.scheduler.domain.engine;

import fr.lapetina.ocr.scheduler.domain.model.PageResult;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntFunction;

/**
 * Engine double producing one page result per selected page.
 */
public final class StubEngine implements InferenceEngine {

    private final int documentPages;
    private final List<PredictOptions> calls = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile IntFunction<PageResult> pageFactory;
    private volatile RuntimeException failure;
    private volatile CountDownLatch gate;

    public StubEngine(int documentPages) {
        this.documentPages = documentPages;
        this.pageFactory = page -> new PageResult(page, Map.of("page", page), "page " + page, Map.of());
    }

    public StubEngine() {
        this(1);
    }

    public StubEngine pages(IntFunction<PageResult> factory) {
        this.pageFactory = factory;
        return this;
    }

    public StubEngine failWith(RuntimeException error) {
        this.failure = error;
        return this;
    }

    /**
     * Makes every predict call wait until the returned latch is released.
     */
    public CountDownLatch blockUntilReleased() {
        CountDownLatch latch = new CountDownLatch(1);
        this.gate = latch;
        return latch;
    }

    @Override
    public List<PageResult> predict(Path input, PredictOptions options) {
        calls.add(options);
        CountDownLatch latch = gate;
        if (latch != null) {
            try {
                latch.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failure != null) {
            throw failure;
        }
        List<PageResult> results = new ArrayList<>();
        for (int page : PageRanges.resolve(options.pageRanges(), documentPages)) {
            results.add(pageFactory.apply(page));
        }
        return results;
    }

    public List<PredictOptions> getCalls() {
        return calls;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
