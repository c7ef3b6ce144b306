package com.flagship.trade_finance.trade;

import com.flagship.trade_finance.action.ActionType;
import com.flagship.trade_finance.error.ErrorKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for action_records.
 *
 * No setters: the request columns are fixed at reservation and only the
 * outcome columns change, through {@link #updateFromDomain(ActionRecord)}.
 * Amounts are ledger base units stored as NUMERIC(78, 0).
 */
@Entity
@Table(
    name = "action_records",
    indexes = {
        @Index(name = "idx_action_records_idempotency_key", columnList = "idempotency_key"),
        @Index(name = "idx_action_records_status", columnList = "status"),
        @Index(name = "idx_action_records_shipment", columnList = "shipment_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ActionRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 32, updatable = false)
    private ActionType actionType;

    @Column(name = "shipment_id", nullable = false, length = 100, updatable = false)
    private String shipmentId;

    @Column(name = "account", nullable = false, length = 100, updatable = false)
    private String account;

    @Column(precision = 78, scale = 0, updatable = false)
    private BigDecimal amount;

    @Column(name = "offer_id")
    private Long offerId;

    @Column(name = "interest_rate_bps", updatable = false)
    private Integer interestRateBps;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ActionRecordStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 40)
    private ErrorKind errorKind;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(columnDefinition = "TEXT")
    private String diagnostic;

    @Column(name = "submission_ref", length = 100)
    private String submissionRef;

    @Column(nullable = false)
    private int confirmations;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static ActionRecordEntity fromDomain(ActionRecord record, String idempotencyKey) {
        return new ActionRecordEntity(
            record.getId(),
            idempotencyKey,
            record.getActionType(),
            record.getShipmentId(),
            record.getAccount(),
            record.getAmount() != null ? new BigDecimal(record.getAmount()) : null,
            record.getOfferId(),
            record.getInterestRateBps(),
            record.getStatus(),
            record.getErrorKind(),
            record.getMessage(),
            record.getDiagnostic(),
            record.getSubmissionRef(),
            record.getConfirmations(),
            record.getAttempts(),
            null, // set by @PrePersist
            null
        );
    }

    public ActionRecord toDomain() {
        return ActionRecord.builder()
                .id(id)
                .actionType(actionType)
                .shipmentId(shipmentId)
                .account(account)
                .amount(amount != null ? amount.toBigInteger() : null)
                .offerId(offerId)
                .interestRateBps(interestRateBps)
                .status(status)
                .errorKind(errorKind)
                .message(message)
                .diagnostic(diagnostic)
                .submissionRef(submissionRef)
                .confirmations(confirmations)
                .attempts(attempts)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }

    /**
     * Copies the outcome columns. Request columns never change.
     */
    void updateFromDomain(ActionRecord record) {
        this.status = record.getStatus();
        this.errorKind = record.getErrorKind();
        this.message = record.getMessage();
        this.diagnostic = record.getDiagnostic();
        this.submissionRef = record.getSubmissionRef();
        this.confirmations = record.getConfirmations();
        this.attempts = record.getAttempts();
        this.offerId = record.getOfferId();
    }
}
