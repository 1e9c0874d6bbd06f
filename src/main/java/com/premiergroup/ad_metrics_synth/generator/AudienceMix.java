package com.premiergroup.ad_metrics_synth.generator;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Share of an hour's audience per segment. Each map sums to 1.0. Informational only.
 */
public record AudienceMix(
        Map<String, Double> device,
        Map<String, Double> age,
        Map<String, Double> gender,
        Map<String, Double> lifeStage,
        Map<String, Double> interest
) {

    /**
     * Evenings (18-22) and weekends lean to CTV and younger viewers; weekday daytime leans to desktop and mobile.
     */
    public static AudienceMix forHour(LocalDateTime hour) {
        DayOfWeek day = hour.getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        boolean evening = hour.getHour() >= 18 && hour.getHour() <= 22;
        boolean leisure = weekend || evening;

        Map<String, Double> device = new LinkedHashMap<>();
        device.put("CTV", leisure ? 0.45 : 0.30);
        device.put("DESKTOP", leisure ? 0.20 : 0.30);
        device.put("MOBILE", leisure ? 0.35 : 0.40);

        Map<String, Double> age = new LinkedHashMap<>();
        age.put("18-24", leisure ? 0.16 : 0.12);
        age.put("25-34", 0.24);
        age.put("35-44", 0.22);
        age.put("45-54", 0.18);
        age.put("55-64", 0.13);
        age.put("65+", 0.07);

        Map<String, Double> gender = new LinkedHashMap<>();
        gender.put("F", 0.5);
        gender.put("M", 0.5);

        Map<String, Double> lifeStage = new LinkedHashMap<>();
        lifeStage.put("SINGLE", 0.35);
        lifeStage.put("PARENT", 0.40);
        lifeStage.put("EMPTY_NEST", 0.25);

        Map<String, Double> interest = new LinkedHashMap<>();
        interest.put("SPORTS", 0.20);
        interest.put("ENTERTAINMENT", 0.30);
        interest.put("FOOD", 0.20);
        interest.put("TECH", 0.15);
        interest.put("TRAVEL", 0.15);

        return new AudienceMix(
                normalize(device),
                normalize(age),
                normalize(gender),
                normalize(lifeStage),
                normalize(interest)
        );
    }

    private static Map<String, Double> normalize(Map<String, Double> shares) {
        double total = shares.values().stream().mapToDouble(Double::doubleValue).sum();
        double divisor = total > 0 ? total : 1.0;
        Map<String, Double> normalized = new LinkedHashMap<>();
        shares.forEach((segment, share) -> normalized.put(segment, share / divisor));
        return normalized;
    }
}
