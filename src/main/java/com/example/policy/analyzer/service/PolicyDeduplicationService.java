package com.example.policy.analyzer.service;

import com.example.policy.analyzer.entity.PolicyEvent;
import com.example.policy.analyzer.repository.PolicyEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Service
@Slf4j
public class PolicyDeduplicationService {

    private final PolicyEventRepository policyEventRepository;

    public PolicyDeduplicationService(PolicyEventRepository policyEventRepository) {
        this.policyEventRepository = policyEventRepository;
    }

    /**
     * Collapses candidates sharing {@code (title, sourceUrl)}, first occurrence wins.
     */
    public static List<PolicyEvent> collapseDuplicates(List<PolicyEvent> candidates) {
        Set<String> seen = new HashSet<>();
        List<PolicyEvent> unique = new ArrayList<>();
        for (PolicyEvent candidate : candidates) {
            if (seen.add(identity(candidate))) {
                unique.add(candidate);
            } else {
                log.debug("Duplicate policy skipped: {}", candidate.getTitle());
            }
        }
        return unique;
    }

    /**
     * Returns the candidates not yet stored. When the store cannot be queried the candidates are
     * returned unchanged and the insert step deals with any duplicates.
     */
    public List<PolicyEvent> filterNew(List<PolicyEvent> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        List<PolicyEvent> unique = collapseDuplicates(candidates);
        List<PolicyEvent> fresh = new ArrayList<>();
        try {
            for (PolicyEvent candidate : unique) {
                if (!exists(candidate)) {
                    fresh.add(candidate);
                } else {
                    log.debug("Policy already stored, skipped: {}", candidate.getTitle());
                }
            }
        } catch (RuntimeException e) {
            log.error("Error filtering new policies, keeping all candidates: {}", e.getMessage());
            return candidates;
        }

        log.info("Filtered {} candidates down to {} new policies", candidates.size(), fresh.size());
        return fresh;
    }

    private boolean exists(PolicyEvent candidate) {
        String title = candidate.getTitle().trim();
        if (candidate.getSourceUrl() == null) {
            return policyEventRepository.existsByTitleAndSourceUrlIsNull(title);
        }
        return policyEventRepository.existsByTitleAndSourceUrl(title, candidate.getSourceUrl());
    }

    private static String identity(PolicyEvent event) {
        return event.getTitle().trim() + "\u0000" + event.getSourceUrl();
    }
}
