package com.premiergroup.ad_metrics_synth.repository;

import com.premiergroup.ad_metrics_synth.entity.CampaignPerformance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface CampaignPerformanceRepository extends JpaRepository<CampaignPerformance, Long> {

    List<CampaignPerformance> findByCampaign_IdOrderByHourTsAsc(Integer campaignId);

    long countByCampaign_Id(Integer campaignId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM CampaignPerformance p WHERE p.campaign.id = :campaignId")
    int deleteByCampaignId(@Param("campaignId") Integer campaignId);
}
