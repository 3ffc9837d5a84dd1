package com.tradecontrol.persistence.repository;

import com.tradecontrol.persistence.entity.PhaseStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PhaseStateJpaRepository extends JpaRepository<PhaseStateEntity, Integer> {}
