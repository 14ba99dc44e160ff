package com.example.policy.analyzer.repository;

import com.example.policy.analyzer.entity.AnalysisOutcome;
import com.example.policy.analyzer.entity.PolicyEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface PolicyEventRepository extends JpaRepository<PolicyEvent, Long> {

    boolean existsByTitleAndSourceUrl(String title, String sourceUrl);

    boolean existsByTitleAndSourceUrlIsNull(String title);

    @Query("select e from PolicyEvent e where not exists "
            + "(select a.id from PolicyAnalysis a where a.policyId = e.id) "
            + "order by e.date desc, e.id desc")
    List<PolicyEvent> findUnanalyzed(Pageable pageable);

    @Query("select e from PolicyEvent e where e.id in "
            + "(select a.policyId from PolicyAnalysis a where a.outcome in :outcomes) "
            + "order by e.date desc, e.id desc")
    List<PolicyEvent> findByAnalysisOutcomeIn(@Param("outcomes") Collection<AnalysisOutcome> outcomes,
            Pageable pageable);

    @Query("select e from PolicyEvent e where e.id in "
            + "(select a.policyId from PolicyAnalysis a where a.fullContent is not null "
            + "and length(a.fullContent) > 0) "
            + "order by e.date desc, e.id desc")
    List<PolicyEvent> findWithStoredContent(Pageable pageable);
}
