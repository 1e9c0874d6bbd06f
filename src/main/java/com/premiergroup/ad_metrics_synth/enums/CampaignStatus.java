package com.premiergroup.ad_metrics_synth.enums;

public enum CampaignStatus {
    ACTIVE,
    INACTIVE,
    PAUSED,
    DRAFT,
    COMPLETED
}
