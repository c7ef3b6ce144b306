package com.flagship.trade_finance.trade;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ActionRecordRepository extends JpaRepository<ActionRecordEntity, UUID> {

    Optional<ActionRecordEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Oldest records in a status first; used to resolve indeterminate actions.
     */
    List<ActionRecordEntity> findByStatusOrderByCreatedAtAsc(ActionRecordStatus status, Pageable page);
}
