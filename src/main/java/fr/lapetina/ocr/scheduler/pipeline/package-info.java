/**
 * Execution of a single job against the shared engine.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ocr.scheduler.pipeline.DocumentPipeline} - Orchestrates one job end to end</li>
 *   <li>{@link fr.lapetina.ocr.scheduler.pipeline.InputMaterializer} - Bounded download and size check</li>
 *   <li>{@link fr.lapetina.ocr.scheduler.pipeline.PdfInspector} - Page counting</li>
 *   <li>{@link fr.lapetina.ocr.scheduler.pipeline.ResultWriter} - layout.json, full.md, images and archive</li>
 * </ul>
 *
 * <h2>Batching</h2>
 * <p>A document longer than the batch size, with no caller page selection, is split into
 * contiguous ranges ({@code 1-50}, {@code 51-100}, ...). Each range is its own engine
 * acquisition, so other jobs can interleave and peak memory stays bounded by one batch.
 * Outputs are appended in range order, so the result matches a single pass.
 */
package fr.lapetina.ocr.scheduler.pipeline;
