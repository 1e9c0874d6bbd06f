package com.premiergroup.ad_metrics_synth.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "flights")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(exclude = "campaign")
@ToString(exclude = "campaign")
public class Flight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false, unique = true)
    private Campaign campaign;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    /**
     * First delivery hour of the flight, midnight UTC of the start date.
     */
    public LocalDateTime firstHour() {
        return startDate.atStartOfDay();
    }

    /**
     * Last delivery hour of the flight: the end date runs through 23:59, floored to 23:00 UTC.
     */
    public LocalDateTime lastHour() {
        return endDate.atTime(23, 0);
    }
}
