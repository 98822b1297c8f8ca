package com.health.consult.service;

import com.health.consult.entity.FeeChangeRequest;
import com.health.consult.entity.Professional;
import com.health.consult.exception.ConsultationException;
import com.health.consult.repository.FeeChangeRequestRepository;
import com.health.consult.repository.ProfessionalRepository;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Fee change requests and their admin review. The active fee of a professional is
 * read from the approved requests, never stored on the professional.
 */
@Service
public class FeeChangeService {

    private static final Logger log = LoggerFactory.getLogger(FeeChangeService.class);

    private final FeeChangeRequestRepository requestRepository;
    private final ProfessionalRepository professionalRepository;
    private final Clock clock;
    private final BigDecimal minFee;
    private final BigDecimal maxFee;

    public FeeChangeService(FeeChangeRequestRepository requestRepository,
                            ProfessionalRepository professionalRepository,
                            Clock clock,
                            @Value("${consult.fee.min:100}") BigDecimal minFee,
                            @Value("${consult.fee.max:10000}") BigDecimal maxFee) {
        this.requestRepository = requestRepository;
        this.professionalRepository = professionalRepository;
        this.clock = clock;
        this.minFee = minFee;
        this.maxFee = maxFee;
    }

    // =========================================================
    // ACTIVE FEE
    // =========================================================
    @Transactional(readOnly = true)
    public BigDecimal activeFee(Long professionalId) {
        Professional professional = professionalRepository.findById(professionalId)
                .orElseThrow(() -> ConsultationException.notFound("Professional not found: " + professionalId));
        return activeFee(professional);
    }

    BigDecimal activeFee(Professional professional) {
        return requestRepository
                .findFirstByProfessionalIdAndStatusOrderByReviewedAtDescIdDesc(
                        professional.getId(),
                        FeeChangeRequest.Status.APPROVED
                )
                .map(FeeChangeRequest::getRequestedFee)
                .orElse(professional.getDefaultFee());
    }

    // =========================================================
    // REQUEST
    // =========================================================
    @Transactional
    public FeeChangeRequest requestChange(Long professionalId, BigDecimal requestedFee, String reason) {
        if (requestedFee == null || requestedFee.compareTo(minFee) < 0 || requestedFee.compareTo(maxFee) > 0) {
            log.warn("Fee request rejected: fee {} outside [{}, {}] for professional {}", requestedFee, minFee, maxFee, professionalId);
            throw ConsultationException.validation("Requested fee must be between " + minFee + " and " + maxFee);
        }
        if (StringUtils.isBlank(reason)) {
            throw ConsultationException.validation("A reason is required for a fee change request");
        }

        // row lock serializes concurrent submissions for the same professional
        Professional professional = professionalRepository.findByIdForUpdate(professionalId)
                .orElseThrow(() -> ConsultationException.notFound("Professional not found: " + professionalId));

        if (requestRepository.existsByProfessionalIdAndStatus(professionalId, FeeChangeRequest.Status.PENDING)) {
            log.warn("Fee request rejected: professional {} already has a pending request", professionalId);
            throw ConsultationException.conflictingRequest("A fee change request is already pending review");
        }

        FeeChangeRequest request = FeeChangeRequest.builder()
                .professionalId(professionalId)
                .currentFee(activeFee(professional))
                .requestedFee(requestedFee)
                .reason(reason.trim())
                .requestedAt(Instant.now(clock))
                .status(FeeChangeRequest.Status.PENDING)
                .build();
        request = requestRepository.save(request);

        log.info("Fee change requested: request={} professional={} {} -> {}",
                request.getId(), professionalId, request.getCurrentFee(), requestedFee);
        return request;
    }

    // =========================================================
    // REVIEW
    // =========================================================
    @Transactional
    public FeeChangeRequest approve(Long requestId, Long adminId, String notes) {
        FeeChangeRequest request = loadPending(requestId);
        request.setStatus(FeeChangeRequest.Status.APPROVED);
        request.setReviewedBy(adminId);
        request.setAdminNotes(StringUtils.trimToNull(notes));
        request.setReviewedAt(Instant.now(clock));
        request = requestRepository.save(request);

        log.info("Fee change approved: request={} professional={} fee={} admin={}",
                requestId, request.getProfessionalId(), request.getRequestedFee(), adminId);
        return request;
    }

    @Transactional
    public FeeChangeRequest reject(Long requestId, Long adminId, String notes) {
        if (StringUtils.isBlank(notes)) {
            throw ConsultationException.validation("A rejection must include notes");
        }
        FeeChangeRequest request = loadPending(requestId);
        request.setStatus(FeeChangeRequest.Status.REJECTED);
        request.setReviewedBy(adminId);
        request.setAdminNotes(notes.trim());
        request.setReviewedAt(Instant.now(clock));
        request = requestRepository.save(request);

        log.info("Fee change rejected: request={} professional={} admin={}",
                requestId, request.getProfessionalId(), adminId);
        return request;
    }

    private FeeChangeRequest loadPending(Long requestId) {
        FeeChangeRequest request = requestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> ConsultationException.notFound("Fee change request not found: " + requestId));
        if (!request.isPending()) {
            log.warn("Review rejected: request {} is already {}", requestId, request.getStatus());
            throw ConsultationException.invalidState("Fee change request " + requestId + " is already " + request.getStatus());
        }
        return request;
    }

    // =========================================================
    // LISTINGS
    // =========================================================
    @Transactional(readOnly = true)
    public List<FeeChangeRequest> requestsOf(Long professionalId) {
        return requestRepository.findByProfessionalIdOrderByRequestedAtDesc(professionalId);
    }

    @Transactional(readOnly = true)
    public List<FeeChangeRequest> requestsWithStatus(FeeChangeRequest.Status status) {
        return requestRepository.findByStatusOrderByRequestedAtAsc(status);
    }
}
