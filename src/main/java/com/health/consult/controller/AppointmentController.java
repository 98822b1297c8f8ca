package com.health.consult.controller;

import com.health.consult.dto.AppointmentView;
import com.health.consult.dto.BookingRequest;
import com.health.consult.dto.JoinResponse;
import com.health.consult.dto.PaymentRequest;
import com.health.consult.dto.PaymentResponse;
import com.health.consult.entity.Appointment;
import com.health.consult.exception.ConsultationException;
import com.health.consult.service.AppointmentService;
import com.health.consult.service.JoinWindow;
import com.health.consult.service.Viewer;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/appointments")
public class AppointmentController {

    private final AppointmentService appointmentService;
    private final JoinWindow joinWindow;
    private final Clock clock;

    public AppointmentController(AppointmentService appointmentService, JoinWindow joinWindow, Clock clock) {
        this.appointmentService = appointmentService;
        this.joinWindow = joinWindow;
        this.clock = clock;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AppointmentView book(@RequestBody BookingRequest request) {
        Appointment appt = appointmentService.book(
                request.getPatientId(),
                request.getProfessionalId(),
                request.getConditionId(),
                request.getChatSessionId(),
                request.getScheduledTime()
        );
        return AppointmentView.of(appt, joinWindow, Instant.now(clock));
    }

    @PostMapping("/{appointmentId}/payment")
    public PaymentResponse pay(@PathVariable Long appointmentId, @RequestBody PaymentRequest request) {
        return PaymentResponse.of(appointmentService.recordPayment(appointmentId, request.getAmount()));
    }

    @GetMapping("/{appointmentId}/join")
    public JoinResponse join(@PathVariable Long appointmentId,
                             @RequestParam(required = false) Long patientId,
                             @RequestParam(required = false) Long professionalId) {
        if (patientId == null && professionalId == null) {
            throw ConsultationException.validation("patientId or professionalId is required");
        }
        Viewer viewer = patientId != null ? Viewer.patient(patientId) : Viewer.professional(professionalId);
        return JoinResponse.of(appointmentService.callAccess(appointmentId, viewer));
    }

    @PostMapping("/{appointmentId}/complete")
    public AppointmentView complete(@PathVariable Long appointmentId) {
        return AppointmentView.of(appointmentService.complete(appointmentId), joinWindow, Instant.now(clock));
    }

    @PostMapping("/{appointmentId}/cancel")
    public AppointmentView cancel(@PathVariable Long appointmentId) {
        return AppointmentView.of(appointmentService.cancel(appointmentId), joinWindow, Instant.now(clock));
    }

    @GetMapping
    public List<AppointmentView> forPatient(@RequestParam Long patientId) {
        Instant now = Instant.now(clock);
        return appointmentService.forPatient(patientId).stream()
                .map(a -> AppointmentView.of(a, joinWindow, now))
                .collect(Collectors.toList());
    }
}
