package com.premiergroup.ad_metrics_synth.entity;

import com.premiergroup.ad_metrics_synth.enums.CampaignStatus;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "campaigns")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "flight")
@ToString(exclude = "flight")
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CampaignStatus status;

    @Column(length = 3)
    private String currency;

    // cents
    @Column(name = "target_cpm")
    private Integer targetCpm;

    @OneToOne(mappedBy = "campaign", cascade = CascadeType.ALL)
    private Flight flight;
}
