package com.premiergroup.ad_metrics_synth.dto;

import com.premiergroup.ad_metrics_synth.generator.DerivedHourlyMetrics;
import com.premiergroup.ad_metrics_synth.generator.RawHourlyMetrics;

public record HourlyPerformanceView(
        RawHourlyMetrics raw,
        DerivedHourlyMetrics derived
) {}
