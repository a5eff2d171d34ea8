package fr.lapetina.ocr.scheduler.pipeline;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;

/**
 * Outcome of one successful pipeline run.
 *
 * @param pagesProcessed page results returned by the engine across all batches
 * @param batches        page-range expressions executed, one per engine acquisition;
 *                       {@link #WHOLE_DOCUMENT} stands for an unrestricted single pass
 * @param pageCount      document page count, empty when unknown
 * @param archived       whether result.zip was produced
 */
public record PipelineResult(
        int pagesProcessed,
        List<String> batches,
        OptionalInt pageCount,
        boolean archived,
        Duration duration
) {

    public static final String WHOLE_DOCUMENT = "all";

    public PipelineResult {
        batches = List.copyOf(batches);
    }

    public boolean isBatched() {
        return batches.size() > 1;
    }
}
