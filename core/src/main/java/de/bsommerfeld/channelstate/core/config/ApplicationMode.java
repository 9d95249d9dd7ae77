package de.bsommerfeld.channelstate.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode of the application. PROD persists connection state to SQLite,
 * TEST keeps it in memory and never touches the disk.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    static final String PROPERTY = "channelstate.mode";
    static final String ENV = "CHANNELSTATE_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code channelstate.mode} system property or
     * the {@code CHANNELSTATE_MODE} environment variable. Unknown or missing
     * values resolve to PROD.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isEmpty()) {
            mode = System.getenv(ENV);
        }

        if (mode == null || mode.isEmpty()) {
            return PROD;
        }

        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}'. Defaulting to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
