package com.proveground.matchengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SportSeasonRepository extends JpaRepository<SportSeasonEntity, Long> {

    List<SportSeasonEntity> findAllByOrderBySportNameAscStartMonthAsc();
}
