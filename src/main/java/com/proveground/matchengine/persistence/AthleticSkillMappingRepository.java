package com.proveground.matchengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AthleticSkillMappingRepository extends JpaRepository<AthleticSkillMappingEntity, Long> {

    List<AthleticSkillMappingEntity> findBySportNameInOrderByTransferStrengthDesc(Collection<String> sportNames);
}
