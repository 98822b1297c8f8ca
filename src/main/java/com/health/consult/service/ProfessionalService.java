package com.health.consult.service;

import com.health.consult.entity.Professional;
import com.health.consult.exception.ConsultationException;
import com.health.consult.repository.ProfessionalRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ProfessionalService {

    private static final Logger log = LoggerFactory.getLogger(ProfessionalService.class);

    private final ProfessionalRepository professionalRepository;

    @Transactional(readOnly = true)
    public Professional get(Long professionalId) {
        return professionalRepository.findById(professionalId)
                .orElseThrow(() -> ConsultationException.notFound("Professional not found: " + professionalId));
    }

    @Transactional(readOnly = true)
    public List<Professional> withStatus(Professional.Status status) {
        return professionalRepository.findByStatusOrderByName(status);
    }

    /** Admin review of a professional's application. Re-approving a rejected profile is allowed. */
    @Transactional
    public Professional updateStatus(Long professionalId, Professional.Status status) {
        if (status == null) {
            throw ConsultationException.validation("Status is required");
        }
        Professional professional = professionalRepository.findByIdForUpdate(professionalId)
                .orElseThrow(() -> ConsultationException.notFound("Professional not found: " + professionalId));
        Professional.Status previous = professional.getStatus();
        professional.setStatus(status);
        professional = professionalRepository.save(professional);
        log.info("Professional {} status {} -> {}", professionalId, previous, status);
        return professional;
    }
}
