package org.example.analyzer.repository;

import org.example.analyzer.entity.ChapterAnalysisResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChapterAnalysisResultRepository extends JpaRepository<ChapterAnalysisResultEntity, String> {

    Optional<ChapterAnalysisResultEntity> findByChapterId(String chapterId);
}
