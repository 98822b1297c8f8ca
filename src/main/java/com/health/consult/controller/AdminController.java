package com.health.consult.controller;

import com.health.consult.dto.AppointmentView;
import com.health.consult.dto.ReviewRequest;
import com.health.consult.entity.Appointment;
import com.health.consult.entity.FeeChangeRequest;
import com.health.consult.entity.Professional;
import com.health.consult.service.AppointmentService;
import com.health.consult.service.FeeChangeService;
import com.health.consult.service.JoinWindow;
import com.health.consult.service.ProfessionalService;
import com.health.consult.service.ReportingService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final FeeChangeService feeChangeService;
    private final ProfessionalService professionalService;
    private final AppointmentService appointmentService;
    private final ReportingService reportingService;
    private final JoinWindow joinWindow;
    private final Clock clock;

    public AdminController(FeeChangeService feeChangeService,
                           ProfessionalService professionalService,
                           AppointmentService appointmentService,
                           ReportingService reportingService,
                           JoinWindow joinWindow,
                           Clock clock) {
        this.feeChangeService = feeChangeService;
        this.professionalService = professionalService;
        this.appointmentService = appointmentService;
        this.reportingService = reportingService;
        this.joinWindow = joinWindow;
        this.clock = clock;
    }

    @GetMapping("/fee-requests")
    public List<FeeChangeRequest> feeRequests(
            @RequestParam(defaultValue = "PENDING") FeeChangeRequest.Status status) {
        return feeChangeService.requestsWithStatus(status);
    }

    @PostMapping("/fee-requests/{requestId}/approve")
    public FeeChangeRequest approve(@PathVariable Long requestId, @RequestBody ReviewRequest review) {
        return feeChangeService.approve(requestId, review.getAdminId(), review.getNotes());
    }

    @PostMapping("/fee-requests/{requestId}/reject")
    public FeeChangeRequest reject(@PathVariable Long requestId, @RequestBody ReviewRequest review) {
        return feeChangeService.reject(requestId, review.getAdminId(), review.getNotes());
    }

    @GetMapping("/professionals")
    public List<Professional> professionals(
            @RequestParam(defaultValue = "PENDING") Professional.Status status) {
        return professionalService.withStatus(status);
    }

    @PutMapping("/professionals/{professionalId}/status")
    public Professional updateProfessionalStatus(@PathVariable Long professionalId,
                                                 @RequestParam Professional.Status status) {
        return professionalService.updateStatus(professionalId, status);
    }

    @GetMapping("/appointments")
    public Page<AppointmentView> appointments(@RequestParam(required = false) Appointment.Status status,
                                              @RequestParam(defaultValue = "0") int page,
                                              @RequestParam(defaultValue = "50") int size) {
        Instant now = Instant.now(clock);
        PageRequest pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "scheduledTime"));
        return appointmentService.all(status, pageable)
                .map(a -> AppointmentView.of(a, joinWindow, now));
    }

    @GetMapping("/analytics/overview")
    public ReportingService.PlatformOverview overview() {
        return reportingService.overview();
    }
}
