package com.jml.weaver.weaving;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide switch deciding whether methods woven from now on receive requirement and
 * ensure checks. The value is read once per method, when the method is woven; methods
 * woven earlier keep the checks they were built with. Loop invariant checks ignore it.
 *
 * Weaving concurrently with a call to {@link #setInstrumentationEnabled(boolean)} is not
 * ordered; callers that do both must serialize them.
 */
public final class InstrumentationToggle {

    private static final Logger logger = LoggerFactory.getLogger(InstrumentationToggle.class);

    private static volatile boolean enabled = true;

    private InstrumentationToggle() {
    }

    /**
     * Enables or disables contract instrumentation for subsequently woven methods.
     *
     * @param value The new state
     * @return The previous state
     */
    public static boolean setInstrumentationEnabled(boolean value) {
        boolean previous = enabled;
        enabled = value;
        logger.info("Contract instrumentation {}", value ? "enabled" : "disabled");
        return previous;
    }

    public static boolean isInstrumentationEnabled() {
        return enabled;
    }
}
