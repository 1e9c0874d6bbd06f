package com.premiergroup.ad_metrics_synth.generator;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar attributes of a delivery hour, denormalised onto each row for daily/weekly/monthly slicing.
 *
 * @param dayOfWeek 0 = Monday .. 6 = Sunday
 */
public record TemporalBreakdown(
        int hourOfDay,
        int dayOfWeek,
        boolean businessHour,
        String humanReadable,
        LocalDate dailyDayDate,
        LocalDate weeklyStartDayDate,
        LocalDate monthlyStartDayDate
) {

    private static final DateTimeFormatter HUMAN_READABLE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'");

    public static TemporalBreakdown of(LocalDateTime hour) {
        int hourOfDay = hour.getHour();
        int dayOfWeek = hour.getDayOfWeek().getValue() - 1;
        LocalDate day = hour.toLocalDate();
        return new TemporalBreakdown(
                hourOfDay,
                dayOfWeek,
                dayOfWeek < 5 && hourOfDay >= 9 && hourOfDay <= 17,
                hour.format(HUMAN_READABLE),
                day,
                day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)),
                day.withDayOfMonth(1)
        );
    }
}
