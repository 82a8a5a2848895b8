/**
 * Request correlation for Log4j2.
 *
 * <p>{@link com.phillippitts.voiceinventory.config.logging.MdcFilter} puts {@code requestId} and
 * {@code sessionId} into the ThreadContext for every HTTP request; the thread pools in
 * {@link com.phillippitts.voiceinventory.config.ThreadPoolConfig} carry them over to recognizer
 * callbacks and extraction rounds.
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 10:15:04.112 [extraction-pool-1] [requestId] [sessionId] INFO logger.name - message
 * </pre>
 */
package com.phillippitts.voiceinventory.config.logging;
