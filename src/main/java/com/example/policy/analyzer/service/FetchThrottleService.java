package com.example.policy.analyzer.service;

import com.example.policy.analyzer.entity.FetchLog;
import com.example.policy.analyzer.repository.FetchLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Keeps each source from being fetched more often than its minimum interval, based on the last
 * attempt recorded in the fetch log.
 */
@Service
@Slf4j
public class FetchThrottleService {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    static final DateTimeFormatter FETCH_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final FetchLogRepository fetchLogRepository;
    private final Clock clock;

    public FetchThrottleService(FetchLogRepository fetchLogRepository, Clock clock) {
        this.fetchLogRepository = fetchLogRepository;
        this.clock = clock;
    }

    /**
     * True when the last attempt, successful or not, was less than {@code minIntervalHours} ago.
     * Missing or unreadable log entries never block a fetch.
     */
    public boolean shouldSkip(String sourceName, int minIntervalHours) {
        Optional<FetchLog> entry;
        try {
            entry = fetchLogRepository.findBySourceName(sourceName);
        } catch (RuntimeException e) {
            log.error("Error checking fetch status for {}: {}", sourceName, e.getMessage());
            return false;
        }
        if (entry.isEmpty()) {
            return false;
        }

        FetchLog fetchLog = entry.get();
        if (fetchLog.getLastFetchTime() == null) {
            return false;
        }
        LocalDateTime lastFetch;
        try {
            lastFetch = LocalDateTime.parse(fetchLog.getLastFetchTime(), FETCH_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            log.warn("Cannot parse last fetch time for {}: {}", sourceName, fetchLog.getLastFetchTime());
            return false;
        }

        Duration elapsed = Duration.between(lastFetch, LocalDateTime.now(clock));
        if (elapsed.compareTo(Duration.ofHours(minIntervalHours)) < 0) {
            log.info("Skipping {}: last {} fetch was {} minutes ago (< {} h)", sourceName,
                    fetchLog.getFetchStatus(), elapsed.toMinutes(), minIntervalHours);
            return true;
        }
        return false;
    }

    public void recordStatus(String sourceName, String status, int recordsFetched, String errorMessage) {
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            FetchLog fetchLog = fetchLogRepository.findBySourceName(sourceName).orElseGet(() -> {
                FetchLog created = new FetchLog();
                created.setSourceName(sourceName);
                created.setCreatedAt(now);
                return created;
            });
            fetchLog.setLastFetchTime(now.format(FETCH_TIME_FORMAT));
            fetchLog.setFetchStatus(status);
            fetchLog.setRecordsFetched(recordsFetched);
            fetchLog.setErrorMessage(truncate(errorMessage));
            fetchLog.setUpdatedAt(now);
            fetchLogRepository.save(fetchLog);

            if (STATUS_SUCCESS.equals(status)) {
                log.info("Recorded successful fetch for {}: {} records", sourceName, recordsFetched);
            } else {
                log.warn("Recorded failed fetch for {}: {}", sourceName, errorMessage);
            }
        } catch (RuntimeException e) {
            log.error("Error recording fetch status for {}: {}", sourceName, e.getMessage());
        }
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }
}
