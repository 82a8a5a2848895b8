/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voiceinventory.exception.VoiceInventoryException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voiceinventory.exception.CaptureException} - Recognizer failures,
 *       categorized by {@link com.phillippitts.voiceinventory.exception.CaptureException.Kind}</li>
 *   <li>{@link com.phillippitts.voiceinventory.exception.ExtractionException} - Model round-trip
 *       failures; carries the transcript being processed</li>
 *   <li>{@link com.phillippitts.voiceinventory.exception.PersistenceException} - Storage failures,
 *       delegated verbatim from the storage collaborator</li>
 *   <li>{@link com.phillippitts.voiceinventory.exception.TaskNotReadyException} - Confirmation
 *       requested for an incomplete or unresolved task</li>
 * </ul>
 *
 * <p>An ambiguous or absent entity name is not an exception: it is a normal
 * {@link com.phillippitts.voiceinventory.service.resolution.Resolution} outcome.
 *
 * @see com.phillippitts.voiceinventory.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voiceinventory.exception;
