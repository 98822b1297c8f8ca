package com.health.consult.repository;

import com.health.consult.entity.FeeChangeRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

public interface FeeChangeRequestRepository extends JpaRepository<FeeChangeRequest, Long> {

    boolean existsByProfessionalIdAndStatus(Long professionalId, FeeChangeRequest.Status status);

    /** Latest review wins; ties on the timestamp fall back to the later request. */
    Optional<FeeChangeRequest> findFirstByProfessionalIdAndStatusOrderByReviewedAtDescIdDesc(
            Long professionalId,
            FeeChangeRequest.Status status
    );

    List<FeeChangeRequest> findByProfessionalIdOrderByRequestedAtDesc(Long professionalId);

    List<FeeChangeRequest> findByStatusOrderByRequestedAtAsc(FeeChangeRequest.Status status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM FeeChangeRequest r WHERE r.id = :id")
    Optional<FeeChangeRequest> findByIdForUpdate(@Param("id") Long id);
}
