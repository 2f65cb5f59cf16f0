package com.flagship.equipment_booking.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RecordRepository extends JpaRepository<RecordEntity, Long> {

    List<RecordEntity> findByCategoryOrderByIdAsc(String category);

    Optional<RecordEntity> findByIdAndCategory(Long id, String category);

    long countByCategory(String category);
}
