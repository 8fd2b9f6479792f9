package com.example.backendtemplate.domain.repository;

import com.example.backendtemplate.domain.entity.SampleEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for SampleEntity.
 * <p>
 * Lookups other than the plain JpaRepository ones only see rows that are active and not deleted.
 */
@Repository
public interface SampleEntityRepository extends JpaRepository<SampleEntity, UUID> {

    Optional<SampleEntity> findByIdAndActiveTrueAndDeletedFalse(UUID id);

    List<SampleEntity> findByActiveTrueAndDeletedFalse(Pageable pageable);

    long countByActiveTrueAndDeletedFalse();

    /**
     * Case-insensitive substring match on the string field
     */
    @Query("""
            SELECT s FROM SampleEntity s
            WHERE LOWER(s.stringField) LIKE LOWER(CONCAT('%', :term, '%'))
              AND s.active = true
              AND s.deleted = false
            """)
    List<SampleEntity> searchByStringField(@Param("term") String term, Pageable pageable);
}
