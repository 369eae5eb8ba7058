package com.querydesk.portal.repository;

import com.querydesk.portal.model.FaqEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FaqEntryRepository extends JpaRepository<FaqEntry, Long> {

    Optional<FaqEntry> findByQuestionKey(String questionKey);

    boolean existsByQuestionKey(String questionKey);

    // Id order stands in for insertion order on frequency ties
    List<FaqEntry> findAllByOrderByFrequencyDescIdAsc();

    List<FaqEntry> findByCategoryIgnoreCaseOrderByFrequencyDescIdAsc(String category);

    List<FaqEntry> findByActiveTrueOrderByFrequencyDescIdAsc();

    List<FaqEntry> findByActiveTrueAndCategoryIgnoreCaseOrderByFrequencyDescIdAsc(String category);

    @Modifying
    @Query("UPDATE FaqEntry f SET f.frequency = f.frequency + 1 WHERE f.questionKey = :key")
    int incrementFrequency(@Param("key") String questionKey);
}
