package com.chartsignal.backend.repository;

import com.chartsignal.backend.model.AnalysisResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AnalysisResultRepository extends JpaRepository<AnalysisResult, Long> {

    List<AnalysisResult> findBySymbolAndTimeframeOrderByAnalysisTimestampDesc(String symbol, String timeframe, Pageable pageable);

    Optional<AnalysisResult> findFirstBySymbolAndTimeframeOrderByAnalysisTimestampDesc(String symbol, String timeframe);

    @Modifying
    @Query("DELETE FROM AnalysisResult a WHERE a.createdAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
