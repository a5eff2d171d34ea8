package fr.lapetina.ocr.scheduler.pipeline;

import fr.lapetina.ocr.scheduler.domain.engine.PageRanges;
import fr.lapetina.ocr.scheduler.domain.engine.PredictOptions;
import fr.lapetina.ocr.scheduler.domain.exception.EngineException;
import fr.lapetina.ocr.scheduler.domain.exception.SchedulerException;
import fr.lapetina.ocr.scheduler.domain.exception.StorageException;
import fr.lapetina.ocr.scheduler.domain.exception.ValidationException;
import fr.lapetina.ocr.scheduler.domain.model.JobOptions;
import fr.lapetina.ocr.scheduler.domain.model.JobSource;
import fr.lapetina.ocr.scheduler.domain.model.PageResult;
import fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig;
import fr.lapetina.ocr.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.scheduler.resource.InferenceContext;
import fr.lapetina.ocr.scheduler.resource.ResourceManager;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Runs one job against the shared engine.
 *
 * <p>Steps: materialize the input, validate size and page limits, choose between a
 * single pass and sequential page batches, persist each batch's output, then write
 * the combined markdown and the optional archive.
 *
 * <p>Validation failures are raised before the engine is acquired. Engine failures
 * propagate to the caller.
 */
public final class DocumentPipeline {

    private static final Logger log = LoggerFactory.getLogger(DocumentPipeline.class);

    private final ResourceManager resourceManager;
    private final InputMaterializer materializer;
    private final PdfInspector pdfInspector;
    private final ResultWriter resultWriter;
    private final MetricsRegistry metricsRegistry;
    private final int maxPages;
    private final boolean autoBatch;
    private final int batchPageSize;
    private final Duration acquireTimeout;

    public DocumentPipeline(
            ResourceManager resourceManager,
            InputMaterializer materializer,
            PdfInspector pdfInspector,
            ResultWriter resultWriter,
            MetricsRegistry metricsRegistry,
            SchedulerConfig.PipelineConfig pipelineConfig,
            SchedulerConfig.ResourceConfig resourceConfig
    ) {
        this.resourceManager = resourceManager;
        this.materializer = materializer;
        this.pdfInspector = pdfInspector;
        this.resultWriter = resultWriter;
        this.metricsRegistry = metricsRegistry;
        this.maxPages = pipelineConfig.getMaxPages();
        this.autoBatch = pipelineConfig.isEnableAutoBatch();
        this.batchPageSize = Math.max(1, pipelineConfig.getBatchPageSize());
        this.acquireTimeout = Duration.ofSeconds(Math.max(
                resourceConfig.getMinAcquireTimeoutSeconds(),
                resourceConfig.getLoadTimeoutSeconds()));
    }

    /**
     * Converts one document and writes its artifacts under {@code paths}.
     *
     * @throws ValidationException if the input breaks a size or page limit
     * @throws SchedulerException  for acquisition, engine and storage failures
     */
    public PipelineResult run(JobSource source, JobPaths paths, JobOptions options) {
        long started = System.nanoTime();

        long stageStart = System.nanoTime();
        Path input = materializer.materialize(source, paths);
        recordStage("materialize", stageStart);

        OptionalInt pageCount = pdfInspector.pageCount(input);
        if (pageCount.isPresent() && pageCount.getAsInt() > maxPages) {
            log.warn("Input rejected: pages={}, maxPages={}", pageCount.getAsInt(), maxPages);
            throw ValidationException.pageLimit(pageCount.getAsInt(), maxPages);
        }
        PageRanges.validate(options.pageRanges());

        List<String> batches = planBatches(pageCount, options);
        log.info("Pipeline start: pages={}, remote={}, batches={}, modelVersion={}, formula={}, table={}, bbox={}, language={}",
                pageCount.isPresent() ? pageCount.getAsInt() : "unknown",
                source.remote(), batches.size(), options.modelVersion(),
                options.enableFormula(), options.enableTable(), options.bbox(), options.language());

        prepareOutput(paths);

        PredictOptions predictOptions = PredictOptions.from(options);
        List<String> pageTexts = new ArrayList<>();
        Set<String> imageNames = new HashSet<>();
        int pagesProcessed = 0;

        for (String batch : batches) {
            String ranges = PipelineResult.WHOLE_DOCUMENT.equals(batch) ? null : batch;
            List<PageResult> pages = infer(input, predictOptions.withPageRanges(ranges), batch);

            stageStart = System.nanoTime();
            resultWriter.appendLayout(paths, pages);
            for (PageResult page : pages) {
                pageTexts.add(resultWriter.writeImages(paths, page, imageNames));
            }
            recordStage("persist", stageStart);
            pagesProcessed += pages.size();
        }

        resultWriter.writeMarkdown(paths, pageTexts);

        if (options.packZip()) {
            stageStart = System.nanoTime();
            resultWriter.packArchive(paths);
            recordStage("package", stageStart);
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        log.info("Pipeline done: pagesProcessed={}, batches={}, durationMs={}",
                pagesProcessed, batches.size(), duration.toMillis());
        return new PipelineResult(pagesProcessed, batches, pageCount, options.packZip(), duration);
    }

    /**
     * Auto-batches only when enabled, the page count is known and above the batch size,
     * and the caller did not restrict pages.
     */
    List<String> planBatches(OptionalInt pageCount, JobOptions options) {
        if (autoBatch
                && pageCount.isPresent()
                && pageCount.getAsInt() > batchPageSize
                && !options.hasPageRanges()) {
            return PageRanges.batches(pageCount.getAsInt(), batchPageSize);
        }
        return List.of(options.hasPageRanges() ? options.pageRanges() : PipelineResult.WHOLE_DOCUMENT);
    }

    private List<PageResult> infer(Path input, PredictOptions predictOptions, String batch) {
        long stageStart = System.nanoTime();
        try (InferenceContext context = resourceManager.inferenceContext(acquireTimeout)) {
            List<PageResult> pages = context.engine().predict(input, predictOptions);
            log.debug("Batch inferred: pages={}, range={}", pages == null ? 0 : pages.size(), batch);
            return pages == null ? List.of() : pages;
        } catch (SchedulerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EngineException("Inference failed for pages " + batch + ": " + e.getMessage(), e);
        } finally {
            recordStage("inference", stageStart);
        }
    }

    private void prepareOutput(JobPaths paths) {
        try {
            Files.createDirectories(paths.imagesDir());
            Files.deleteIfExists(paths.layoutFile());
        } catch (IOException e) {
            throw new StorageException("Cannot prepare output directory", e);
        }
    }

    private void recordStage(String stage, long startNanos) {
        if (metricsRegistry != null) {
            metricsRegistry.recordStageLatency(stage, Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }
}
