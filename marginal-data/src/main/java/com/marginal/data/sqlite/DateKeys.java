package com.marginal.data.sqlite;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Dates are stored as yyyyMMdd text, which sorts and compares like the date itself.
 */
public final class DateKeys {

    private DateKeys() {}

    public static String format(LocalDate date) {
        return date.format(DateTimeFormatter.BASIC_ISO_DATE);
    }

    public static LocalDate parse(String key) {
        return LocalDate.parse(key.trim(), DateTimeFormatter.BASIC_ISO_DATE);
    }
}
