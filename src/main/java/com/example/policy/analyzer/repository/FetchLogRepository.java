package com.example.policy.analyzer.repository;

import com.example.policy.analyzer.entity.FetchLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface FetchLogRepository extends JpaRepository<FetchLog, Long> {
    Optional<FetchLog> findBySourceName(String sourceName);
}
