package com.dailycode.domain.delivery.repository;

import com.dailycode.domain.delivery.model.DeliveryOutcome;
import com.dailycode.domain.delivery.model.DeliveryRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DeliveryRecordRepository extends JpaRepository<DeliveryRecord, Long> {

    Optional<DeliveryRecord> findFirstBySubscriberIdAndProblemIdAndOutcome(String subscriberId, String problemId,
                                                                          DeliveryOutcome outcome);

    List<DeliveryRecord> findBySubscriberIdOrderByAttemptedAtAsc(String subscriberId);

    List<DeliveryRecord> findBySubscriberIdInAndOutcome(Collection<String> subscriberIds, DeliveryOutcome outcome);

    @Query("select max(r.attemptedAt) from DeliveryRecord r")
    Optional<Instant> findLatestAttemptedAt();

    @Query("select r.problemId from DeliveryRecord r where r.subscriberId = :subscriberId and r.outcome = :outcome")
    List<String> findProblemIds(@Param("subscriberId") String subscriberId, @Param("outcome") DeliveryOutcome outcome);
}
