/**
 * OCR Job Scheduler - bounded job queue and engine scheduling core for document conversion.
 *
 * <p>Documents submitted by URL or upload are queued, converted one page batch at a time
 * against a single shared inference engine, and written to a per-job directory with a
 * durable status file. Results can be published and handed out through single-use,
 * expiring download tokens.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ocr.scheduler.SchedulerFactory} - Main entry point for creating
 *       a fully-wired scheduler from YAML configuration</li>
 *   <li>{@link fr.lapetina.ocr.scheduler.OcrSchedulerApplication} - Standalone HTTP server
 *       exposing task submission, status and downloads</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SchedulerFactory factory = SchedulerFactory.create("config.yaml").start()) {
 *     Job job = factory.getSubmissionService()
 *             .submitRemote("https://example.org/paper.pdf", JobOptions.defaults());
 *
 *     Job done = job.completion().get();
 *     System.out.println(done.getStatus());
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Bounded queue with immediate rejection when full</li>
 *   <li>Lazy engine load with backend fallback and idle unload</li>
 *   <li>GPU memory gate sizing concurrency from free memory</li>
 *   <li>Automatic page batching of long documents</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Per-client token bucket rate limiting</li>
 * </ul>
 *
 * @see fr.lapetina.ocr.scheduler.SchedulerFactory
 * @see fr.lapetina.ocr.scheduler.queue.JobQueue
 */
package fr.lapetina.ocr.scheduler;
