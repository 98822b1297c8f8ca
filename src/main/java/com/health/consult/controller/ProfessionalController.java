package com.health.consult.controller;

import com.health.consult.dto.AppointmentView;
import com.health.consult.dto.FeeChangeForm;
import com.health.consult.dto.HistoryEntry;
import com.health.consult.entity.Appointment;
import com.health.consult.entity.FeeChangeRequest;
import com.health.consult.exception.ConsultationException;
import com.health.consult.service.AppointmentService;
import com.health.consult.service.ChatSessionService;
import com.health.consult.service.FeeChangeService;
import com.health.consult.service.JoinWindow;
import com.health.consult.service.ReportingService;
import com.health.consult.service.Viewer;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/professionals/{professionalId}")
public class ProfessionalController {

    private final AppointmentService appointmentService;
    private final ChatSessionService chatSessionService;
    private final FeeChangeService feeChangeService;
    private final ReportingService reportingService;
    private final JoinWindow joinWindow;
    private final Clock clock;

    public ProfessionalController(AppointmentService appointmentService,
                                  ChatSessionService chatSessionService,
                                  FeeChangeService feeChangeService,
                                  ReportingService reportingService,
                                  JoinWindow joinWindow,
                                  Clock clock) {
        this.appointmentService = appointmentService;
        this.chatSessionService = chatSessionService;
        this.feeChangeService = feeChangeService;
        this.reportingService = reportingService;
        this.joinWindow = joinWindow;
        this.clock = clock;
    }

    @GetMapping("/appointments")
    public List<AppointmentView> appointments(@PathVariable Long professionalId) {
        return toViews(appointmentService.forProfessional(professionalId));
    }

    @GetMapping("/appointments/upcoming")
    public List<AppointmentView> upcoming(@PathVariable Long professionalId) {
        return toViews(appointmentService.upcomingForProfessional(professionalId));
    }

    @GetMapping("/appointments/{appointmentId}/history")
    public List<HistoryEntry> history(@PathVariable Long professionalId, @PathVariable Long appointmentId) {
        Appointment appt = appointmentService.getForProfessional(appointmentId, professionalId);
        if (appt.getChatSessionId() == null) {
            throw ConsultationException.notFound("Appointment " + appointmentId + " has no intake chat");
        }
        return chatSessionService.getAnswers(appt.getChatSessionId(), Viewer.professional(professionalId)).stream()
                .map(HistoryEntry::of)
                .collect(Collectors.toList());
    }

    @PostMapping("/fee-requests")
    @ResponseStatus(HttpStatus.CREATED)
    public FeeChangeRequest requestFeeChange(@PathVariable Long professionalId, @RequestBody FeeChangeForm form) {
        return feeChangeService.requestChange(professionalId, form.getRequestedFee(), form.getReason());
    }

    @GetMapping("/fee-requests")
    public List<FeeChangeRequest> feeRequests(@PathVariable Long professionalId) {
        return feeChangeService.requestsOf(professionalId);
    }

    @GetMapping("/fee")
    public Map<String, BigDecimal> activeFee(@PathVariable Long professionalId) {
        return Map.of("consultationFee", feeChangeService.activeFee(professionalId));
    }

    @GetMapping("/stats")
    public ReportingService.ProfessionalStats stats(@PathVariable Long professionalId) {
        return reportingService.professionalStats(professionalId);
    }

    private List<AppointmentView> toViews(List<Appointment> appointments) {
        Instant now = Instant.now(clock);
        return appointments.stream()
                .map(a -> AppointmentView.of(a, joinWindow, now))
                .collect(Collectors.toList());
    }
}
