/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.voiceinventory.config.ThreadPoolConfig} - Executors for capture
 *       callbacks and extraction rounds</li>
 *   <li>{@link com.phillippitts.voiceinventory.config.pipeline.PipelineConfig} - Wiring of the
 *       capture controller, model client and extraction pipeline</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code voice.*} configuration properties</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.voiceinventory.config;
