package com.premiergroup.ad_metrics_synth.generator;

import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Multiplicative seasonal scale for a delivery hour: hour-of-day boost, day-of-week weight, flight ramp and
 * annual cycle. No randomness and no state.
 */
@Component
public class TemporalFactorEngine {

    private static final double PEAK_HOUR = 13.0;
    private static final double PEAK_SIGMA = 2.5;
    private static final double PEAK_UPLIFT = 0.45;
    private static final double HOURS_PER_WEEK = 168.0;
    private static final double DAYS_PER_YEAR = 365.0;

    public double factor(TemporalContext context) {
        return factor(context.flightStart(), context.hour(), context.flightEnd());
    }

    public double factor(LocalDateTime flightStart, LocalDateTime hour, LocalDateTime flightEnd) {
        return hourOfDayBoost(hour)
                * dayOfWeekFactor(hour)
                * flightRampFactor(flightStart, hour, flightEnd)
                * annualFactor(hour);
    }

    /**
     * Gaussian uplift between 09:00 and 17:00 peaking at 13:00 (~1.45), 1.0 elsewhere.
     */
    public double hourOfDayBoost(LocalDateTime hour) {
        int h = hour.getHour();
        if (h < 9 || h > 17) {
            return 1.0;
        }
        double x = (h - PEAK_HOUR) / PEAK_SIGMA;
        return 1.0 + PEAK_UPLIFT * Math.exp(-0.5 * x * x);
    }

    public double dayOfWeekFactor(LocalDateTime hour) {
        DayOfWeek day = hour.getDayOfWeek();
        return switch (day) {
            case FRIDAY -> 0.97;
            case SATURDAY -> 0.88;
            case SUNDAY -> 0.92;
            default -> 1.00;
        };
    }

    /**
     * Logistic S-curve over the elapsed share of the flight (0.85 to 1.15) with a mild weekly oscillation.
     */
    public double flightRampFactor(LocalDateTime flightStart, LocalDateTime hour, LocalDateTime flightEnd) {
        double totalHours = Math.max(1.0, hoursBetween(flightStart, flightEnd));
        double elapsedHours = hoursBetween(flightStart, hour);
        double t = Math.min(1.0, Math.max(0.0, elapsedHours / totalHours));

        double sigmoid = 1.0 / (1.0 + Math.exp(-6.0 * (t - 0.5)));
        double ramp = 0.85 + 0.30 * sigmoid;
        double weekly = 1.0 + 0.03 * Math.sin(2.0 * Math.PI * elapsedHours / HOURS_PER_WEEK);
        return ramp * weekly;
    }

    /**
     * Cosine over the day of year, 1.0 on January 1st down to ~0.8 mid-year.
     */
    public double annualFactor(LocalDateTime hour) {
        double x = 2.0 * Math.PI * (hour.getDayOfYear() - 1) / DAYS_PER_YEAR;
        return (Math.cos(x) + 1.0) / 10.0 + 0.8;
    }

    private static double hoursBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).getSeconds() / 3600.0;
    }
}
