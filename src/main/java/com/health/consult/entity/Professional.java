package com.health.consult.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(name = "professional")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Professional {

    public enum Status { PENDING, APPROVED, REJECTED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    /** Nutritionist, trainer, yoga instructor. */
    @Column(nullable = false, length = 60)
    private String specialty;

    /** Fee charged until the first fee change request is approved. */
    @Column(name = "default_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal defaultFee;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "professional_condition", joinColumns = @JoinColumn(name = "professional_id"))
    @Column(name = "condition_id", nullable = false, length = 50)
    @Builder.Default
    private Set<String> conditionIds = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.PENDING;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public boolean offers(String conditionId) {
        return status == Status.APPROVED && conditionIds.contains(conditionId);
    }
}
