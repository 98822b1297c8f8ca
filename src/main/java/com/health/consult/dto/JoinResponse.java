package com.health.consult.dto;

import com.health.consult.service.AppointmentService;
import com.health.consult.service.JoinWindow;

public record JoinResponse(Long appointmentId,
                           boolean canJoin,
                           JoinWindow.TimeStatus.Phase phase,
                           String timeStatus,
                           String meetingLink) {

    public static JoinResponse of(AppointmentService.CallAccess access) {
        return new JoinResponse(
                access.appointment().getId(),
                access.canJoin(),
                access.timeStatus().phase(),
                access.timeStatus().label(),
                access.meetingLink()
        );
    }
}
