package com.health.consult.service;

import com.health.consult.entity.Appointment;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Call eligibility around an appointment's scheduled time. Everything here is a pure
 * function of the stored appointment and the caller's clock; nothing is persisted.
 */
@Component
public class JoinWindow {

    private final Duration before;
    private final Duration after;

    public JoinWindow(@Value("${consult.join-window.before-minutes:15}") long beforeMinutes,
                      @Value("${consult.join-window.after-minutes:60}") long afterMinutes) {
        this.before = Duration.ofMinutes(beforeMinutes);
        this.after = Duration.ofMinutes(afterMinutes);
    }

    public boolean canJoinCall(Appointment appointment, Instant now) {
        return appointment.isPaid()
                && appointment.getStatus() == Appointment.Status.SCHEDULED
                && isWithinWindow(appointment.getScheduledTime(), now);
    }

    /** Inclusive at both ends: exactly 15 minutes before and 60 minutes after are inside. */
    public boolean isWithinWindow(Instant scheduledTime, Instant now) {
        Instant opens = scheduledTime.minus(before);
        Instant closes = scheduledTime.plus(after);
        return !now.isBefore(opens) && !now.isAfter(closes);
    }

    public TimeStatus timeStatus(Appointment appointment, Instant now) {
        if (appointment.getStatus() == Appointment.Status.CANCELLED) {
            return new TimeStatus(TimeStatus.Phase.CANCELLED, "Cancelled");
        }
        if (appointment.getStatus() == Appointment.Status.COMPLETED) {
            return new TimeStatus(TimeStatus.Phase.COMPLETED, "Completed");
        }

        Instant scheduled = appointment.getScheduledTime();
        if (isWithinWindow(scheduled, now)) {
            return new TimeStatus(TimeStatus.Phase.IN_PROGRESS, "In progress");
        }
        if (now.isAfter(scheduled)) {
            return new TimeStatus(TimeStatus.Phase.COMPLETED, "Completed");
        }

        long minutes = Duration.between(now, scheduled).toMinutes();
        long hours = minutes / 60;
        if (hours >= 24) {
            long days = hours / 24;
            return new TimeStatus(TimeStatus.Phase.UPCOMING, "Starts in " + days + " day" + (days > 1 ? "s" : ""));
        }
        if (hours >= 1) {
            return new TimeStatus(TimeStatus.Phase.UPCOMING, "Starts in " + hours + "h " + (minutes % 60) + "m");
        }
        return new TimeStatus(TimeStatus.Phase.UPCOMING, "Starts in " + minutes + " minutes");
    }

    public record TimeStatus(Phase phase, String label) {

        public enum Phase { UPCOMING, IN_PROGRESS, COMPLETED, CANCELLED }
    }
}
