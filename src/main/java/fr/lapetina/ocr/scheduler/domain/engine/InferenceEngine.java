package fr.lapetina.ocr.scheduler.domain.engine;

import fr.lapetina.ocr.scheduler.domain.model.PageResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Opaque document-conversion capability.
 *
 * Every backend variant implements this fixed contract; options it does not
 * understand are ignored by the implementation rather than negotiated at call time.
 * Implementations need not be thread-safe unless their backend is flagged as
 * concurrency-safe in configuration.
 */
public interface InferenceEngine extends AutoCloseable {

    /**
     * Converts the selected pages of a document.
     *
     * @param input   local path of the PDF or image
     * @param options recognition toggles and page selection
     * @return page results in ascending page order
     */
    List<PageResult> predict(Path input, PredictOptions options);

    /**
     * Releases the engine and any accelerator memory it holds.
     */
    @Override
    void close();
}
