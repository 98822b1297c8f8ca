package com.health.consult.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_patient", columnList = "patient_id"),
    @Index(name = "idx_appointment_professional", columnList = "professional_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Appointment {

    public enum Status { SCHEDULED, COMPLETED, CANCELLED }

    public enum PaymentStatus { PENDING, PAID }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @Column(name = "professional_id", nullable = false)
    private Long professionalId;

    @Column(name = "condition_id", nullable = false, length = 50)
    private String conditionId;

    /** Intake session whose answers make up the medical history. One appointment per session. */
    @Column(name = "chat_session_id", unique = true)
    private Long chatSessionId;

    @Column(name = "scheduled_time", nullable = false)
    private Instant scheduledTime;

    /** Professional's active fee at booking time, never recomputed. */
    @Column(name = "consultation_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal consultationFee;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.SCHEDULED;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false)
    @Builder.Default
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    @Column(name = "meeting_link", unique = true, length = 200)
    private String meetingLink;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean isPaid() {
        return paymentStatus == PaymentStatus.PAID;
    }
}
