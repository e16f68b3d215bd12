package com.dailycode.domain.delivery.repository;

import com.dailycode.domain.delivery.model.DeliveryRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.time.Instant;
import java.util.Optional;

public interface DeliveryRunRepository extends JpaRepository<DeliveryRun, Long> {

    @Query("select max(r.startedAt) from DeliveryRun r")
    Optional<Instant> findLatestStartedAt();
}
