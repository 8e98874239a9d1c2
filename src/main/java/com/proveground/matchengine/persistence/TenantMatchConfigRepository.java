package com.proveground.matchengine.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TenantMatchConfigRepository extends JpaRepository<TenantMatchConfigEntity, Long> {

    Optional<TenantMatchConfigEntity> findByTenantId(String tenantId);
}
