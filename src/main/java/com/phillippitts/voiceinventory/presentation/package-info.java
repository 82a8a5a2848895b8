/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>The HTTP boundary of the application. Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for capture and task operations</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters. Business logic lives in the extraction pipeline and the
 * capture controller; handlers map domain exceptions to HTTP status codes.
 *
 * @see com.phillippitts.voiceinventory.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.voiceinventory.presentation;
