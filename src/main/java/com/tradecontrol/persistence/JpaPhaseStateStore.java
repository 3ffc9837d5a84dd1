package com.tradecontrol.persistence;

import com.tradecontrol.domain.model.PhaseState;
import com.tradecontrol.persistence.entity.PhaseStateEntity;
import com.tradecontrol.persistence.mapper.PhaseStateMapper;
import com.tradecontrol.persistence.repository.PhaseStateJpaRepository;
import com.tradecontrol.phase.PhaseStateStore;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaPhaseStateStore implements PhaseStateStore {

    private static final PhaseStateMapper MAPPER = Mappers.getMapper(PhaseStateMapper.class);

    private final PhaseStateJpaRepository phaseStateJpaRepository;

    public JpaPhaseStateStore(PhaseStateJpaRepository phaseStateJpaRepository) {
        this.phaseStateJpaRepository = phaseStateJpaRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PhaseState> load() {
        return phaseStateJpaRepository.findById(PhaseStateEntity.SINGLETON_ID).map(MAPPER::toDomain);
    }

    @Override
    @Transactional
    public void save(PhaseState state) {
        phaseStateJpaRepository.save(MAPPER.toEntity(state));
    }
}
