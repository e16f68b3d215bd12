package com.dailycode.domain.subscriber.repository;

import com.dailycode.domain.subscriber.model.Subscriber;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface SubscriberRepository extends JpaRepository<Subscriber, String> {

    List<Subscriber> findByActiveTrueOrderByIdAsc();

    long countByActiveTrue();
}
