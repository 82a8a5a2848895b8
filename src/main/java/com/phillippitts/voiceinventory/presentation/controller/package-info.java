/**
 * REST controllers.
 *
 * <ul>
 *   <li>{@code VoiceSessionController} - {@code /api/voice}: capture control, recognizer callbacks,
 *       task operations</li>
 *   <li>{@code PingController} - {@code GET /ping} for checking structured logging</li>
 * </ul>
 */
package com.phillippitts.voiceinventory.presentation.controller;
