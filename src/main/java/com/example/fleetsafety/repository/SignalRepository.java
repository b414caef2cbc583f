package com.example.fleetsafety.repository;

import com.example.fleetsafety.domain.Signal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SignalRepository extends JpaRepository<Signal, String> {

    Optional<Signal> findByCompanyIdAndSourceEventId(Long companyId, String sourceEventId);

    @Query("SELECT s FROM Signal s WHERE s.companyId = :companyId AND s.vehicleId = :vehicleId " +
           "AND s.occurredAt BETWEEN :from AND :to ORDER BY s.occurredAt ASC")
    List<Signal> findForVehicleBetween(Long companyId, String vehicleId, Instant from, Instant to);

    @Query("SELECT s FROM Signal s WHERE s.companyId = :companyId AND s.driverId = :driverId " +
           "AND s.occurredAt BETWEEN :from AND :to ORDER BY s.occurredAt ASC")
    List<Signal> findForDriverBetween(Long companyId, String driverId, Instant from, Instant to);
}
