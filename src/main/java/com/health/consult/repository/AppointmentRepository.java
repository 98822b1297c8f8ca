package com.health.consult.repository;

import com.health.consult.entity.Appointment;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    List<Appointment> findByPatientIdOrderByScheduledTimeDesc(Long patientId);

    List<Appointment> findByProfessionalIdOrderByScheduledTimeDesc(Long professionalId);

    List<Appointment> findByProfessionalIdAndStatusAndScheduledTimeGreaterThanEqualOrderByScheduledTimeAsc(
            Long professionalId,
            Appointment.Status status,
            Instant from
    );

    Page<Appointment> findByStatus(Appointment.Status status, Pageable pageable);

    Optional<Appointment> findByChatSessionId(Long chatSessionId);

    boolean existsByChatSessionIdAndProfessionalId(Long chatSessionId, Long professionalId);

    long countByStatus(Appointment.Status status);

    long countByProfessionalId(Long professionalId);

    long countByProfessionalIdAndStatus(Long professionalId, Appointment.Status status);

    long countByProfessionalIdAndStatusAndScheduledTimeGreaterThanEqual(
            Long professionalId,
            Appointment.Status status,
            Instant from
    );

    long countByPaymentStatus(Appointment.PaymentStatus paymentStatus);

    @Query("SELECT COALESCE(SUM(a.consultationFee), 0) FROM Appointment a WHERE a.paymentStatus = :paymentStatus")
    BigDecimal sumFeesByPaymentStatus(@Param("paymentStatus") Appointment.PaymentStatus paymentStatus);

    @Query("SELECT COALESCE(SUM(a.consultationFee), 0) FROM Appointment a "
            + "WHERE a.paymentStatus = :paymentStatus AND a.professionalId = :professionalId")
    BigDecimal sumFeesForProfessionalByPaymentStatus(
            @Param("professionalId") Long professionalId,
            @Param("paymentStatus") Appointment.PaymentStatus paymentStatus
    );

    long countByCreatedAtGreaterThanEqual(Instant from);

    @Query("SELECT COALESCE(SUM(a.consultationFee), 0) FROM Appointment a "
            + "WHERE a.paymentStatus = :paymentStatus AND a.createdAt >= :from")
    BigDecimal sumFeesByPaymentStatusCreatedSince(
            @Param("paymentStatus") Appointment.PaymentStatus paymentStatus,
            @Param("from") Instant from
    );

    @Query("SELECT COALESCE(SUM(a.consultationFee), 0) FROM Appointment a "
            + "WHERE a.paymentStatus = :paymentStatus AND a.professionalId = :professionalId AND a.createdAt >= :from")
    BigDecimal sumFeesForProfessionalByPaymentStatusCreatedSince(
            @Param("professionalId") Long professionalId,
            @Param("paymentStatus") Appointment.PaymentStatus paymentStatus,
            @Param("from") Instant from
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Appointment a WHERE a.id = :id")
    Optional<Appointment> findByIdForUpdate(@Param("id") Long id);
}
