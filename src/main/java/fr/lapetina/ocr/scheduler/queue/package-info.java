/**
 * Bounded job queue and its worker pool.
 *
 * <p>Submissions never block: a full queue rejects at once with
 * {@link fr.lapetina.ocr.scheduler.domain.exception.BackpressureException}. Workers
 * drain the queue in FIFO order and drive each job through
 * {@code queued -> processing -> succeeded | failed}, persisting every state before
 * it becomes visible to listeners or to {@link fr.lapetina.ocr.scheduler.domain.model.Job#completion()}.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ocr.scheduler.queue.JobQueue} - Queue, workers and status persistence</li>
 *   <li>{@link fr.lapetina.ocr.scheduler.queue.JobSubmissionService} - Job directory creation and admission</li>
 *   <li>{@link fr.lapetina.ocr.scheduler.queue.JobStatusListener} - Status change callbacks</li>
 * </ul>
 */
package fr.lapetina.ocr.scheduler.queue;
