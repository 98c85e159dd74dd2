package org.example.analyzer.repository;

import org.example.analyzer.entity.AnalysisCheckpointEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface AnalysisCheckpointRepository extends JpaRepository<AnalysisCheckpointEntity, String> {

    Optional<AnalysisCheckpointEntity> findByChapterId(String chapterId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM AnalysisCheckpointEntity c WHERE c.chapterId = :chapterId")
    int deleteByChapterId(@Param("chapterId") String chapterId);
}
