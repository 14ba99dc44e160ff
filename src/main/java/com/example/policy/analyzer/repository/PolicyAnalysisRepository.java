package com.example.policy.analyzer.repository;

import com.example.policy.analyzer.entity.AnalysisOutcome;
import com.example.policy.analyzer.entity.PolicyAnalysis;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PolicyAnalysisRepository extends JpaRepository<PolicyAnalysis, Long> {

    Optional<PolicyAnalysis> findByPolicyId(Long policyId);

    long countByOutcome(AnalysisOutcome outcome);

    // Coarse text match; callers re-check the parsed industry list
    List<PolicyAnalysis> findByOutcomeAndIndustriesContaining(AnalysisOutcome outcome, String keyword);
}
