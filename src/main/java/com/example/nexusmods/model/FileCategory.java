package com.example.nexusmods.model;

import java.util.Locale;

/**
 * File category as reported in {@code category_name}.
 */
public enum FileCategory {
    MAIN,
    UPDATE,
    OPTIONAL,
    OLD_VERSION,
    MISCELLANEOUS,
    ARCHIVED;

    /**
     * Value used by the {@code category} query filter of the files endpoint.
     */
    public String queryValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
