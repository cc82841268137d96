package com.mtsa.findings.repository;

import com.mtsa.findings.model.GenerationEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface GenerationEventRepository extends JpaRepository<GenerationEvent, UUID> {

    /**
     * Per generator: calls, successful calls, average latency and the latest call time.
     */
    @Query("SELECT e.generatorId, COUNT(e), SUM(CASE WHEN e.success = true THEN 1 ELSE 0 END), AVG(e.latencyMs), MAX(e.occurredAt) "
            + "FROM GenerationEvent e GROUP BY e.generatorId ORDER BY e.generatorId")
    List<Object[]> summarizeByGenerator();
}
