/**
 * Exception-to-HTTP translation for the voice API.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.voiceinventory.exception.TaskNotReadyException} and
 *       {@code IllegalStateException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.voiceinventory.exception.ExtractionException} → 429, 422, 400, 502,
 *       503 or 409 by kind</li>
 *   <li>{@link com.phillippitts.voiceinventory.exception.PersistenceException} → 503 Service Unavailable</li>
 *   <li>{@code IllegalArgumentException} and request validation failures → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "TaskNotReadyException",
 *   "message": "Task is not ready for confirmation",
 *   "details": "missing=[category], unresolved=[location]",
 *   "timestamp": "2026-03-02T10:15:04.112Z"
 * }
 * </pre>
 */
package com.phillippitts.voiceinventory.presentation.exception;
