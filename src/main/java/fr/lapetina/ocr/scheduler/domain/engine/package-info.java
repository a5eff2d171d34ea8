/**
 * Contract between the scheduler and the document-conversion engine.
 *
 * <p>The engine is a black box behind {@link fr.lapetina.ocr.scheduler.domain.engine.InferenceEngine};
 * instances are built by an {@link fr.lapetina.ocr.scheduler.domain.engine.EngineProvider} and owned by
 * the {@link fr.lapetina.ocr.scheduler.resource.ResourceManager}, which is the only component
 * allowed to create or close them.
 */
package fr.lapetina.ocr.scheduler.domain.engine;
