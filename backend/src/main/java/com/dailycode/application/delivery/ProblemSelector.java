package com.dailycode.application.delivery;

import com.dailycode.application.delivery.exception.NoContentAvailableException;
import com.dailycode.config.DailyCodeProperties;
import com.dailycode.domain.problem.model.Problem;
import com.dailycode.domain.subscriber.model.Subscriber;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.zip.CRC32;

/**
 * Picks the problem a subscriber receives on a given date.
 * The result depends only on the arguments, so the same snapshots always give the same answer.
 */
@Component
public class ProblemSelector {

    private final SelectionPolicy policy;

    public ProblemSelector(DailyCodeProperties properties) {
        this(properties.delivery().selectionPolicy());
    }

    ProblemSelector(SelectionPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param catalog   catalog snapshot taken at run start
     * @param delivered problem identities already delivered successfully to this subscriber
     * @param date      delivery date, used only by {@link SelectionPolicy#RANDOM}
     * @throws NoContentAvailableException when every matching problem has been delivered
     */
    public Problem select(Subscriber subscriber, List<Problem> catalog, Set<String> delivered, LocalDate date) {
        List<Problem> candidates = catalog.stream()
                .filter(p -> subscriber.getDifficulty().matches(p.getDifficulty()))
                .filter(p -> !delivered.contains(p.getId()))
                .sorted(Comparator.comparing(Problem::getId))
                .toList();

        if (candidates.isEmpty()) {
            throw new NoContentAvailableException(subscriber.getId());
        }

        return switch (policy) {
            case LOWEST_ID -> candidates.get(0);
            case RANDOM -> candidates.get(new Random(seed(subscriber.getId(), date)).nextInt(candidates.size()));
        };
    }

    static long seed(String subscriberId, LocalDate date) {
        CRC32 crc = new CRC32();
        crc.update(subscriberId.getBytes(StandardCharsets.UTF_8));
        return crc.getValue() * 31 + date.toEpochDay();
    }
}
