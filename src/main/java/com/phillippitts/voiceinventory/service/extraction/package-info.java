/**
 * Turns operator utterances into field updates for the active task.
 *
 * <p>{@link com.phillippitts.voiceinventory.service.extraction.ExtractionPipeline} owns the
 * conversation for one task at a time. Each final transcript becomes a round on a single worker:
 * sanitize, detect intent, prompt the generative model, merge the returned values, then resolve
 * spoken references against the entity directory. Rounds started before a confirm or abandon
 * are discarded when they complete.
 *
 * <p>{@link com.phillippitts.voiceinventory.service.extraction.ExtractionService} wraps the model
 * call with retries for transient failures.
 */
package com.phillippitts.voiceinventory.service.extraction;
