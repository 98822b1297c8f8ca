package com.health.consult.dto;

import com.health.consult.entity.Appointment;

public record PaymentResponse(Long appointmentId, Appointment.PaymentStatus paymentStatus, String meetingLink) {

    public static PaymentResponse of(Appointment a) {
        return new PaymentResponse(a.getId(), a.getPaymentStatus(), a.getMeetingLink());
    }
}
