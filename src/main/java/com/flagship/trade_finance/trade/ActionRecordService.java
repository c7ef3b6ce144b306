package com.flagship.trade_finance.trade;

import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.outbox.OutboxService;
import com.flagship.trade_finance.trade.event.ShipmentActionConfirmedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for action records, and the outbox write that goes with a
 * confirmed outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionRecordService {

    private final ActionRecordRepository repository;
    private final OutboxService outboxService;

    /**
     * Claims an idempotency key by writing a PENDING record in its own
     * transaction, committed before the ledger is touched.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException if the key is already taken
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ActionRecord reserve(String idempotencyKey, ActionRequest request) {
        ActionRecordEntity saved = repository.saveAndFlush(
                ActionRecordEntity.fromDomain(ActionRecord.pending(request), idempotencyKey));
        log.debug("Reserved action record {} for idempotency key {}", saved.getId(), idempotencyKey);
        return saved.toDomain();
    }

    /**
     * Stores the coordinator's outcome. A confirmed outcome also writes a
     * ShipmentActionConfirmed event to the outbox in the same transaction.
     */
    @Transactional
    public ActionRecord complete(UUID recordId, ActionResult result) {
        ActionRecordEntity entity = repository.findById(recordId)
                .orElseThrow(() -> new IllegalArgumentException("Action record not found: " + recordId));

        ActionRecord completed = entity.toDomain().complete(result);
        entity.updateFromDomain(completed);
        repository.save(entity);

        if (result.isConfirmed()) {
            outboxService.saveEvent(ShipmentActionConfirmedEvent.from(result, completed.getAccount()));
        }
        log.debug("Action record {} is now {}", recordId, completed.getStatus());
        return completed;
    }

    @Transactional(readOnly = true)
    public Optional<ActionRecord> findById(UUID recordId) {
        return repository.findById(recordId).map(ActionRecordEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<ActionRecord> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(ActionRecordEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<ActionRecord> findIndeterminate(int limit) {
        return repository.findByStatusOrderByCreatedAtAsc(ActionRecordStatus.INDETERMINATE, PageRequest.of(0, limit))
                .stream()
                .map(ActionRecordEntity::toDomain)
                .toList();
    }
}
