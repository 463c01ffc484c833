package com.flagship.bookkeeping.asset;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FixedAssetRepository extends JpaRepository<FixedAssetEntity, Long> {

    List<FixedAssetEntity> findByDeletedFalseOrderByAcquisitionDateAscIdAsc();

    Optional<FixedAssetEntity> findByIdAndDeletedFalse(Long id);

    long countByDeletedFalse();
}
