package com.mtsa.findings.service;

import com.mtsa.findings.dto.FindingsStatistics;
import com.mtsa.findings.dto.GeneratorPerformance;
import com.mtsa.findings.model.FindingsRecord;
import com.mtsa.findings.model.JobStatus;
import com.mtsa.findings.repository.FindingsRecordRepository;
import com.mtsa.findings.repository.GenerationEventRepository;
import com.mtsa.findings.repository.UsageEventRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only operational view over records, jobs, usage events and generator calls.
 */
@Service
public class FindingsStatisticsService {

    private final FindingsRecordRepository recordRepository;
    private final UsageEventRepository usageEventRepository;
    private final GenerationEventRepository generationEventRepository;
    private final ComputationJobStore jobStore;

    public FindingsStatisticsService(FindingsRecordRepository recordRepository,
                                     UsageEventRepository usageEventRepository,
                                     GenerationEventRepository generationEventRepository,
                                     ComputationJobStore jobStore) {
        this.recordRepository = recordRepository;
        this.usageEventRepository = usageEventRepository;
        this.generationEventRepository = generationEventRepository;
        this.jobStore = jobStore;
    }

    @Transactional(readOnly = true)
    public FindingsStatistics statistics() {
        Map<String, Long> byLanguage = toCounts(recordRepository.countActiveByLanguage());
        Map<String, Long> byType = toCounts(recordRepository.countActiveByType());
        long active = byLanguage.values().stream().mapToLong(Long::longValue).sum();

        List<FindingsStatistics.AccessedCombination> mostAccessed = recordRepository
                .findTop10ByActiveTrueOrderByAccessCountDesc().stream()
                .map(this::toAccessed)
                .toList();

        Map<String, Long> jobs = new LinkedHashMap<>();
        for (Map.Entry<JobStatus, Long> entry : jobStore.countsByStatus().entrySet()) {
            jobs.put(entry.getKey().name(), entry.getValue());
        }

        return new FindingsStatistics(
                active,
                byLanguage,
                byType,
                mostAccessed,
                jobs,
                usageEventRepository.countByCacheHit(true),
                usageEventRepository.countByCacheHit(false),
                generationEventRepository.summarizeByGenerator().stream().map(this::toPerformance).toList());
    }

    private GeneratorPerformance toPerformance(Object[] row) {
        return new GeneratorPerformance(
                (String) row[0],
                ((Number) row[1]).longValue(),
                row[2] != null ? ((Number) row[2]).longValue() : 0L,
                row[3] != null ? ((Number) row[3]).doubleValue() : 0.0,
                (OffsetDateTime) row[4]);
    }

    private FindingsStatistics.AccessedCombination toAccessed(FindingsRecord record) {
        return new FindingsStatistics.AccessedCombination(
                record.getCombinationHash(),
                record.getToolName(),
                record.getSourceIds(),
                record.getLanguage(),
                record.getAccessCount());
    }

    private static Map<String, Long> toCounts(List<Object[]> rows) {
        Map<String, Long> counts = new TreeMap<>();
        for (Object[] row : rows) {
            counts.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        return counts;
    }
}
