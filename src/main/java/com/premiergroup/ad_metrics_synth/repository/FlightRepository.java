package com.premiergroup.ad_metrics_synth.repository;

import com.premiergroup.ad_metrics_synth.entity.Flight;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface FlightRepository extends JpaRepository<Flight, Integer> {

    Optional<Flight> findByCampaign_Id(Integer campaignId);
}
