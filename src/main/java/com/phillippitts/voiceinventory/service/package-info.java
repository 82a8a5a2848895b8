/**
 * Service layer containing business logic and domain services.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.capture} - Speech capture session state and recognizer restarts</li>
 *   <li>{@code service.extraction} - Model-driven field extraction and the per-task pipeline</li>
 *   <li>{@code service.matching} - String similarity scoring</li>
 *   <li>{@code service.resolution} - Matching spoken names against stored entities</li>
 *   <li>{@code service.context} - Conversation history, speaker inference and intent detection</li>
 *   <li>{@code service.task} - Active task types and their field sets</li>
 *   <li>{@code service.persistence} - Entity lookup and record storage</li>
 *   <li>{@code service.speech} - Spoken replies</li>
 *   <li>{@code service.metrics}, {@code service.health}, {@code service.events} - Observability</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw domain exceptions, never HTTP exceptions.
 *
 * @since 1.0
 */
package com.phillippitts.voiceinventory.service;
