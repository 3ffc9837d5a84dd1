package com.tradecontrol.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Single-row table holding the last evaluated phase. The metric snapshot is stored as JSON.
 */
@Entity
@Table(name = "phase_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PhaseStateEntity {

    public static final int SINGLETON_ID = 1;

    @Id
    private Integer id;

    private int phase;

    private double readiness;

    @Column(name = "manual_override")
    private boolean manualOverride;

    @Column(name = "metrics_json", length = 4000)
    private String metricsJson;

    @Column(name = "evaluated_at", nullable = false)
    private Instant evaluatedAt;
}
