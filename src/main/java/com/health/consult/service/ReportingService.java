package com.health.consult.service;

import com.health.consult.entity.Appointment;
import com.health.consult.entity.Professional;
import com.health.consult.repository.AppointmentRepository;
import com.health.consult.repository.ProfessionalRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Read-only dashboard figures over stored appointments. Monthly figures cover
 * appointments created since the first day of the current UTC month.
 */
@Service
public class ReportingService {

    private final AppointmentRepository appointmentRepository;
    private final ProfessionalRepository professionalRepository;
    private final ProfessionalService professionalService;
    private final FeeChangeService feeChangeService;
    private final Clock clock;
    private final BigDecimal commissionRate;

    public ReportingService(AppointmentRepository appointmentRepository,
                            ProfessionalRepository professionalRepository,
                            ProfessionalService professionalService,
                            FeeChangeService feeChangeService,
                            Clock clock,
                            @Value("${consult.commission.rate:0.15}") BigDecimal commissionRate) {
        this.appointmentRepository = appointmentRepository;
        this.professionalRepository = professionalRepository;
        this.professionalService = professionalService;
        this.feeChangeService = feeChangeService;
        this.clock = clock;
        this.commissionRate = commissionRate;
    }

    @Transactional(readOnly = true)
    public PlatformOverview overview() {
        BigDecimal revenue = appointmentRepository.sumFeesByPaymentStatus(Appointment.PaymentStatus.PAID);
        Instant monthStart = startOfMonth();
        BigDecimal monthRevenue = appointmentRepository.sumFeesByPaymentStatusCreatedSince(
                Appointment.PaymentStatus.PAID, monthStart);
        return new PlatformOverview(
                professionalRepository.count(),
                professionalRepository.countByStatus(Professional.Status.APPROVED),
                appointmentRepository.count(),
                appointmentRepository.countByStatus(Appointment.Status.SCHEDULED),
                appointmentRepository.countByStatus(Appointment.Status.COMPLETED),
                appointmentRepository.countByStatus(Appointment.Status.CANCELLED),
                appointmentRepository.countByPaymentStatus(Appointment.PaymentStatus.PAID),
                revenue,
                commissionOf(revenue),
                appointmentRepository.countByCreatedAtGreaterThanEqual(monthStart),
                monthRevenue,
                commissionOf(monthRevenue)
        );
    }

    @Transactional(readOnly = true)
    public ProfessionalStats professionalStats(Long professionalId) {
        Professional professional = professionalService.get(professionalId);
        BigDecimal gross = appointmentRepository.sumFeesForProfessionalByPaymentStatus(
                professionalId, Appointment.PaymentStatus.PAID);
        BigDecimal commission = commissionOf(gross);
        BigDecimal monthGross = appointmentRepository.sumFeesForProfessionalByPaymentStatusCreatedSince(
                professionalId, Appointment.PaymentStatus.PAID, startOfMonth());
        BigDecimal monthCommission = commissionOf(monthGross);
        return new ProfessionalStats(
                professionalId,
                professional.getName(),
                appointmentRepository.countByProfessionalId(professionalId),
                appointmentRepository.countByProfessionalIdAndStatus(professionalId, Appointment.Status.COMPLETED),
                appointmentRepository.countByProfessionalIdAndStatusAndScheduledTimeGreaterThanEqual(
                        professionalId, Appointment.Status.SCHEDULED, Instant.now(clock)),
                gross,
                commission,
                gross.subtract(commission),
                monthGross,
                monthCommission,
                monthGross.subtract(monthCommission),
                feeChangeService.activeFee(professional)
        );
    }

    private Instant startOfMonth() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC))
                .withDayOfMonth(1)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
    }

    private BigDecimal commissionOf(BigDecimal amount) {
        return amount.multiply(commissionRate).setScale(2, RoundingMode.HALF_UP);
    }

    public record PlatformOverview(long totalProfessionals,
                                   long approvedProfessionals,
                                   long totalAppointments,
                                   long scheduledAppointments,
                                   long completedAppointments,
                                   long cancelledAppointments,
                                   long paidAppointments,
                                   BigDecimal totalRevenue,
                                   BigDecimal platformCommission,
                                   long appointmentsThisMonth,
                                   BigDecimal revenueThisMonth,
                                   BigDecimal commissionThisMonth) {
    }

    public record ProfessionalStats(Long professionalId,
                                    String professionalName,
                                    long totalAppointments,
                                    long completedAppointments,
                                    long upcomingAppointments,
                                    BigDecimal grossEarnings,
                                    BigDecimal platformCommission,
                                    BigDecimal netEarnings,
                                    BigDecimal grossEarningsThisMonth,
                                    BigDecimal commissionThisMonth,
                                    BigDecimal netEarningsThisMonth,
                                    BigDecimal consultationFee) {
    }
}
