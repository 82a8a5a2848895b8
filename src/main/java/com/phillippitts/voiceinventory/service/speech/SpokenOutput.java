package com.phillippitts.voiceinventory.service.speech;

/**
 * Plain-text handoff to a text-to-speech collaborator.
 */
public interface SpokenOutput {

    /**
     * @param text plain text without markup
     */
    void speak(String text);
}
