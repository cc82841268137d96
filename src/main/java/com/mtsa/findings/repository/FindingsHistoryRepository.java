package com.mtsa.findings.repository;

import com.mtsa.findings.model.FindingsHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FindingsHistoryRepository extends JpaRepository<FindingsHistory, UUID> {

    List<FindingsHistory> findByCombinationHashOrderByChangedAtDesc(String combinationHash);
}
