package com.mtsa.findings.repository;

import com.mtsa.findings.model.UsageEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface UsageEventRepository extends JpaRepository<UsageEvent, UUID> {

    long countByCacheHit(boolean cacheHit);
}
