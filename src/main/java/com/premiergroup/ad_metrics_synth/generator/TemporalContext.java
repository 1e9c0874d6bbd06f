package com.premiergroup.ad_metrics_synth.generator;

import java.time.LocalDateTime;

/**
 * Position of one UTC hour inside a flight window.
 */
public record TemporalContext(
        LocalDateTime flightStart,
        LocalDateTime flightEnd,
        LocalDateTime hour
) {}
