package com.health.consult.dto;

import com.health.consult.entity.Appointment;
import com.health.consult.service.JoinWindow;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Appointment as listed to patients and professionals, with the live call status.
 * The meeting link is only exposed while the call can be joined.
 */
public record AppointmentView(Long id,
                              Long patientId,
                              Long professionalId,
                              String conditionId,
                              Long chatSessionId,
                              Instant scheduledTime,
                              BigDecimal consultationFee,
                              Appointment.Status status,
                              Appointment.PaymentStatus paymentStatus,
                              boolean canJoin,
                              String timeStatus,
                              String meetingLink) {

    public static AppointmentView of(Appointment a, JoinWindow window, Instant now) {
        boolean canJoin = window.canJoinCall(a, now);
        return new AppointmentView(
                a.getId(),
                a.getPatientId(),
                a.getProfessionalId(),
                a.getConditionId(),
                a.getChatSessionId(),
                a.getScheduledTime(),
                a.getConsultationFee(),
                a.getStatus(),
                a.getPaymentStatus(),
                canJoin,
                window.timeStatus(a, now).label(),
                canJoin ? a.getMeetingLink() : null
        );
    }
}
