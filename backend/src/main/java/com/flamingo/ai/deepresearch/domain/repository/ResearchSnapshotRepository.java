package com.flamingo.ai.deepresearch.domain.repository;

import com.flamingo.ai.deepresearch.domain.entity.ResearchSnapshot;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ResearchSnapshot entities. */
@Repository
public interface ResearchSnapshotRepository extends JpaRepository<ResearchSnapshot, UUID> {}
