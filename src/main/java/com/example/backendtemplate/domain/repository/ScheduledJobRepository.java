package com.example.backendtemplate.domain.repository;

import com.example.backendtemplate.domain.entity.ScheduledJobRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJobRecord, String> {
}
