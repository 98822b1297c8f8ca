package com.health.consult.service;

import com.health.consult.entity.Appointment;
import com.health.consult.entity.ChatSession;
import com.health.consult.entity.Professional;
import com.health.consult.exception.ConsultationException;
import com.health.consult.repository.AppointmentRepository;
import com.health.consult.repository.ChatSessionRepository;
import com.health.consult.repository.ProfessionalRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    private final AppointmentRepository appointmentRepository;
    private final ProfessionalRepository professionalRepository;
    private final ChatSessionRepository sessionRepository;
    private final FeeChangeService feeChangeService;
    private final MeetingLinkGenerator meetingLinkGenerator;
    private final JoinWindow joinWindow;
    private final Clock clock;

    // =========================================================
    // BOOK
    // =========================================================

    /**
     * Books a consultation at the professional's active fee. The chat session is optional
     * and does not have to be completed; time slot collisions are not checked.
     */
    @Transactional
    public Appointment book(Long patientId,
                            Long professionalId,
                            String conditionId,
                            Long chatSessionId,
                            Instant scheduledTime) {

        Instant now = Instant.now(clock);
        if (scheduledTime == null || !scheduledTime.isAfter(now)) {
            log.warn("Booking rejected: scheduled time {} is not in the future", scheduledTime);
            throw ConsultationException.invalidTime("Scheduled time must be in the future");
        }

        Professional professional = professionalRepository.findById(professionalId)
                .filter(p -> p.getStatus() == Professional.Status.APPROVED)
                .orElseThrow(() -> ConsultationException.notFound("Professional not available: " + professionalId));

        if (chatSessionId != null) {
            // locked so two bookings cannot both link the same session
            ChatSession session = sessionRepository.findByIdForUpdate(chatSessionId)
                    .orElseThrow(() -> ConsultationException.notFound("Chat session not found: " + chatSessionId));
            if (!Objects.equals(session.getPatientId(), patientId)) {
                log.warn("Booking rejected: session {} does not belong to patient {}", chatSessionId, patientId);
                throw ConsultationException.sessionNotOwned("Chat session " + chatSessionId + " belongs to another patient");
            }
            if (!Objects.equals(session.getProfessionalId(), professionalId)
                    || !Objects.equals(session.getConditionId(), conditionId)) {
                log.warn("Booking rejected: session {} was started for professional {} / condition {}, not {} / {}",
                        chatSessionId, session.getProfessionalId(), session.getConditionId(), professionalId, conditionId);
                throw ConsultationException.invalidState("Chat session " + chatSessionId
                        + " was started for a different professional or condition");
            }
            if (appointmentRepository.findByChatSessionId(chatSessionId).isPresent()) {
                throw ConsultationException.invalidState("Chat session " + chatSessionId + " is already linked to an appointment");
            }
        }

        BigDecimal fee = feeChangeService.activeFee(professional);

        Appointment appointment = Appointment.builder()
                .patientId(patientId)
                .professionalId(professionalId)
                .conditionId(conditionId)
                .chatSessionId(chatSessionId)
                .scheduledTime(scheduledTime)
                .consultationFee(fee)
                .status(Appointment.Status.SCHEDULED)
                .paymentStatus(Appointment.PaymentStatus.PENDING)
                .createdAt(now)
                .build();
        appointment = appointmentRepository.save(appointment);

        log.info("Booked appointment: id={} patient={} professional={} time={} fee={}",
                appointment.getId(), patientId, professionalId, scheduledTime, fee);
        return appointment;
    }

    // =========================================================
    // PAYMENT (MOCK)
    // =========================================================
    @Transactional
    public Appointment recordPayment(Long appointmentId, BigDecimal amount) {
        Appointment appt = lockAppointment(appointmentId);

        if (appt.isPaid()) {
            log.warn("Payment rejected: appointment {} already paid", appointmentId);
            throw ConsultationException.alreadyPaid("Appointment " + appointmentId + " is already paid");
        }
        if (amount == null || amount.compareTo(appt.getConsultationFee()) != 0) {
            log.warn("Payment rejected: amount {} does not match fee {} for appointment {}",
                    amount, appt.getConsultationFee(), appointmentId);
            throw ConsultationException.amountMismatch(
                    "Payment amount must equal the consultation fee " + appt.getConsultationFee());
        }
        if (appt.getStatus() != Appointment.Status.SCHEDULED) {
            throw ConsultationException.invalidState("Appointment " + appointmentId + " is " + appt.getStatus());
        }

        appt.setPaymentStatus(Appointment.PaymentStatus.PAID);
        appt.setPaidAt(Instant.now(clock));
        appt.setMeetingLink(meetingLinkGenerator.generate());
        appt = appointmentRepository.save(appt);

        log.info("Payment recorded: appointment={} amount={}", appointmentId, amount);
        return appt;
    }

    // =========================================================
    // COMPLETE / CANCEL
    // =========================================================
    @Transactional
    public Appointment complete(Long appointmentId) {
        Appointment appt = lockAppointment(appointmentId);
        if (appt.getStatus() != Appointment.Status.SCHEDULED || !appt.isPaid()) {
            throw ConsultationException.invalidState(
                    "Only a paid, scheduled appointment can be completed; appointment " + appointmentId
                            + " is " + appt.getStatus() + "/" + appt.getPaymentStatus());
        }
        appt.setStatus(Appointment.Status.COMPLETED);
        appt = appointmentRepository.save(appt);
        log.info("Completed appointment {}", appointmentId);
        return appt;
    }

    @Transactional
    public Appointment cancel(Long appointmentId) {
        Appointment appt = lockAppointment(appointmentId);
        if (appt.getStatus() != Appointment.Status.SCHEDULED) {
            throw ConsultationException.invalidState("Appointment " + appointmentId + " is already " + appt.getStatus());
        }
        appt.setStatus(Appointment.Status.CANCELLED);
        appt = appointmentRepository.save(appt);
        log.info("Cancelled appointment {} for patient {}", appointmentId, appt.getPatientId());
        return appt;
    }

    private Appointment lockAppointment(Long appointmentId) {
        return appointmentRepository.findByIdForUpdate(appointmentId)
                .orElseThrow(() -> ConsultationException.notFound("Appointment not found: " + appointmentId));
    }

    // =========================================================
    // CALL ELIGIBILITY
    // =========================================================
    @Transactional(readOnly = true)
    public CallAccess callAccess(Long appointmentId, Viewer viewer) {
        Appointment appt = get(appointmentId);
        Long participant = viewer.role() == Viewer.Role.PATIENT ? appt.getPatientId() : appt.getProfessionalId();
        if (!Objects.equals(participant, viewer.id())) {
            throw ConsultationException.forbidden("Not a participant of appointment " + appointmentId);
        }
        Instant now = Instant.now(clock);
        boolean canJoin = joinWindow.canJoinCall(appt, now);
        return new CallAccess(appt, canJoin, joinWindow.timeStatus(appt, now), canJoin ? appt.getMeetingLink() : null);
    }

    public record CallAccess(Appointment appointment,
                             boolean canJoin,
                             JoinWindow.TimeStatus timeStatus,
                             String meetingLink) {
    }

    // =========================================================
    // QUERIES
    // =========================================================
    @Transactional(readOnly = true)
    public Appointment get(Long appointmentId) {
        return appointmentRepository.findById(appointmentId)
                .orElseThrow(() -> ConsultationException.notFound("Appointment not found: " + appointmentId));
    }

    /** An appointment as seen by its professional; anybody else gets {@code FORBIDDEN}. */
    @Transactional(readOnly = true)
    public Appointment getForProfessional(Long appointmentId, Long professionalId) {
        Appointment appt = get(appointmentId);
        if (!Objects.equals(appt.getProfessionalId(), professionalId)) {
            throw ConsultationException.forbidden("Appointment " + appointmentId + " belongs to another professional");
        }
        return appt;
    }

    @Transactional(readOnly = true)
    public List<Appointment> forPatient(Long patientId) {
        return appointmentRepository.findByPatientIdOrderByScheduledTimeDesc(patientId);
    }

    @Transactional(readOnly = true)
    public List<Appointment> forProfessional(Long professionalId) {
        return appointmentRepository.findByProfessionalIdOrderByScheduledTimeDesc(professionalId);
    }

    @Transactional(readOnly = true)
    public List<Appointment> upcomingForProfessional(Long professionalId) {
        return appointmentRepository
                .findByProfessionalIdAndStatusAndScheduledTimeGreaterThanEqualOrderByScheduledTimeAsc(
                        professionalId,
                        Appointment.Status.SCHEDULED,
                        Instant.now(clock)
                );
    }

    @Transactional(readOnly = true)
    public Page<Appointment> all(Appointment.Status status, Pageable pageable) {
        return status == null
                ? appointmentRepository.findAll(pageable)
                : appointmentRepository.findByStatus(status, pageable);
    }
}
