package com.flagship.store_credit.code;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface RedemptionCodeRepository extends JpaRepository<RedemptionCodeEntity, UUID> {

    Optional<RedemptionCodeEntity> findByCode(String code);

    boolean existsByCode(String code);
}
