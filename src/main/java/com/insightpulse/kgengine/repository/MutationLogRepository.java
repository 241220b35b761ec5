package com.insightpulse.kgengine.repository;

import com.insightpulse.kgengine.model.audit.MutationLogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Insert-and-read access to the mutation ledger. Deliberately not a JpaRepository:
 * no delete or bulk-update methods are exposed.
 */
@org.springframework.stereotype.Repository
public interface MutationLogRepository extends Repository<MutationLogEntry, Long> {

    MutationLogEntry save(MutationLogEntry entry);

    Optional<MutationLogEntry> findById(Long id);

    List<MutationLogEntry> findByTargetOrderByIdAsc(String target);

    List<MutationLogEntry> findAllByOrderByIdDesc(Pageable pageable);
}
