package de.bsommerfeld.dbkeeper.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the application. {@link #TEST} swaps the on-disk database
 * for an in-memory one so nothing is persisted.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    static final String PROPERTY = "app.mode";
    static final String ENV_VARIABLE = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * {@code -Dapp.mode} wins over {@code APP_MODE}. Blank or unknown values
     * fall back to {@link #PROD}.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENV_VARIABLE));
    }

    static ApplicationMode resolve(String property, String environment) {
        String mode = isBlank(property) ? environment : property;
        if (isBlank(mode))
            return PROD;

        try {
            return valueOf(mode.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', running as PROD", mode);
            return PROD;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public boolean isTest() {
        return this == TEST;
    }
}
