package org.netpreserve.pdfharvest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * How to surface more links once the portal has run dry.
 */
public enum RefreshMode {
    /** click "load more" style controls */
    PULL,
    /** click "next page" style controls */
    PAGINATION,
    /** only scroll to trigger lazy loading */
    NONE;

    private static final Logger log = LoggerFactory.getLogger(RefreshMode.class);

    @JsonCreator
    public static RefreshMode fromString(String value) {
        if (value == null || value.isBlank()) return NONE;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown refresh_mode {}, treating as 'none'", value);
            return NONE;
        }
    }

    @Override
    @JsonValue
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
