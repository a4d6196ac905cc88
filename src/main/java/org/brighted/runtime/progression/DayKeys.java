package org.brighted.runtime.progression;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Calendar-day keys ({@code yyyy-MM-dd}) used by daily counters.
 */
public final class DayKeys {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private DayKeys() {}

    public static String of(Instant instant, ZoneId zone) {
        return LocalDate.ofInstant(instant, zone).format(FORMAT);
    }
}
