/**
 * Typed failures raised by the scheduler.
 *
 * <p>All exceptions are unchecked and extend
 * {@link fr.lapetina.ocr.scheduler.domain.exception.SchedulerException}, which carries an
 * {@link fr.lapetina.ocr.scheduler.domain.model.ErrorType}. The kind, not the message, is the
 * contract: job status files, HTTP error bodies and metrics all key on it.
 *
 * <h2>Taxonomy</h2>
 * <ul>
 *   <li>Admission: {@link fr.lapetina.ocr.scheduler.domain.exception.BackpressureException}</li>
 *   <li>Validation: {@link fr.lapetina.ocr.scheduler.domain.exception.ValidationException}</li>
 *   <li>Contention: {@link fr.lapetina.ocr.scheduler.domain.exception.AcquisitionTimeoutException}</li>
 *   <li>Engine: {@link fr.lapetina.ocr.scheduler.domain.exception.EngineLoadException},
 *       {@link fr.lapetina.ocr.scheduler.domain.exception.EngineException}</li>
 *   <li>Boundary: {@link fr.lapetina.ocr.scheduler.domain.exception.PathViolationException}</li>
 * </ul>
 */
package fr.lapetina.ocr.scheduler.domain.exception;
