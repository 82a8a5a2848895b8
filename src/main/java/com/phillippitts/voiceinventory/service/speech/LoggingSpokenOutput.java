package com.phillippitts.voiceinventory.service.speech;

import com.phillippitts.voiceinventory.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link SpokenOutput} for headless deployments: logs the reply and keeps the latest one for clients
 * that render or voice it themselves.
 */
public class LoggingSpokenOutput implements SpokenOutput {

    private static final Logger LOG = LogManager.getLogger(LoggingSpokenOutput.class);

    private final AtomicReference<String> lastSpoken = new AtomicReference<>("");

    @Override
    public void speak(String text) {
        lastSpoken.set(text == null ? "" : text);
        LOG.info("Spoken reply: '{}'", LogSanitizer.preview(text));
    }

    public String lastSpoken() {
        return lastSpoken.get();
    }
}
