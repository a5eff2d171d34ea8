package fr.lapetina.ocr.scheduler.domain.engine;

import fr.lapetina.ocr.scheduler.domain.model.JobOptions;

/**
 * Options passed to one {@link InferenceEngine#predict} call.
 *
 * @param pageRanges 1-based inclusive selection such as {@code 1-50}, or null for every page
 * @param modelVersion model variant, or null for the backend default
 */
public record PredictOptions(
        boolean ocr,
        boolean enableFormula,
        boolean enableTable,
        String language,
        String pageRanges,
        String modelVersion
) {

    public static PredictOptions from(JobOptions options) {
        return new PredictOptions(
                options.ocr(),
                options.enableFormula(),
                options.enableTable(),
                options.language(),
                options.pageRanges(),
                options.modelVersion()
        );
    }

    public PredictOptions withPageRanges(String ranges) {
        return new PredictOptions(ocr, enableFormula, enableTable, language, ranges, modelVersion);
    }
}
