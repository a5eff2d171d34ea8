/**
 * Configuration loading.
 *
 * <p>The configuration is a YAML document parsed with SnakeYAML into
 * {@link fr.lapetina.ocr.scheduler.infrastructure.config.SchedulerConfig}. It is read once
 * at startup; every field has a default so a partial file is valid.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP surface (port, backlog, handler threads)</li>
 *   <li>{@code storage} - job storage root and retention</li>
 *   <li>{@code queue} - worker count, queue capacity, poll interval</li>
 *   <li>{@code resource} - engine backend, fallback, memory gate and idle unload</li>
 *   <li>{@code pipeline} - upload and page limits, auto-batching</li>
 *   <li>{@code publish} - result publishing backend</li>
 *   <li>{@code tokens} - download token persistence and defaults</li>
 *   <li>{@code rateLimit} - per-client token buckets</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.ocr.scheduler.infrastructure.config.ConfigLoader
 */
package fr.lapetina.ocr.scheduler.infrastructure.config;
