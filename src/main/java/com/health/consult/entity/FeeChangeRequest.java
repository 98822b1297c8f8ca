package com.health.consult.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A professional's request to change their consultation fee. Reviewed requests are
 * immutable; the approved ones form the fee history the active fee is derived from.
 */
@Entity
@Table(name = "fee_change_request", indexes = {
    @Index(name = "idx_fee_request_professional", columnList = "professional_id, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FeeChangeRequest {

    public enum Status { PENDING, APPROVED, REJECTED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "professional_id", nullable = false)
    private Long professionalId;

    @Column(name = "current_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal currentFee;

    @Column(name = "requested_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal requestedFee;

    @Column(nullable = false, length = 1000)
    private String reason;

    @Column(name = "requested_at", nullable = false, updatable = false)
    private Instant requestedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.PENDING;

    @Column(name = "reviewed_by")
    private Long reviewedBy;

    @Column(name = "admin_notes", length = 1000)
    private String adminNotes;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Version
    private Long version;

    public boolean isPending() {
        return status == Status.PENDING;
    }
}
