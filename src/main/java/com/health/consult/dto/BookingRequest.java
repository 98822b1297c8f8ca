package com.health.consult.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequest {

    private Long patientId;

    private Long professionalId;

    private String conditionId;

    /** Optional; links the intake answers to the appointment. */
    private Long chatSessionId;

    /** Absolute instant, e.g. {@code 2026-11-02T09:30:00Z}. */
    private Instant scheduledTime;
}
