package com.dailycode.application.delivery;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one coordinator run. Entries are ordered by subscriber identity.
 */
public record RunReport(
        String runId,
        TriggerSource source,
        Instant startedAt,
        Instant finishedAt,
        List<RunEntry> entries
) {

    public RunReport {
        entries = List.copyOf(entries);
    }

    public long count(EntryOutcome outcome) {
        return entries.stream().filter(e -> e.outcome() == outcome).count();
    }

    public long degradedCount() {
        return entries.stream().filter(RunEntry::degraded).count();
    }

    public Map<EntryOutcome, Long> countsByOutcome() {
        Map<EntryOutcome, Long> counts = new EnumMap<>(EntryOutcome.class);
        for (EntryOutcome outcome : EntryOutcome.values()) {
            counts.put(outcome, count(outcome));
        }
        return counts;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public String summary() {
        return String.format("run %s (%s): %d subscribers, %d sent (%d degraded), %d failed, "
                        + "%d without content, %d not attempted, %d interrupted in %d ms",
                runId, source, entries.size(), count(EntryOutcome.SUCCESS), degradedCount(),
                count(EntryOutcome.FAILED), count(EntryOutcome.NO_CONTENT_AVAILABLE),
                count(EntryOutcome.NOT_ATTEMPTED), count(EntryOutcome.INTERRUPTED), duration().toMillis());
    }
}
