package com.trading.assetgraph.util;

import com.trading.assetgraph.api.InferenceListener;
import com.trading.assetgraph.api.SkipReason;

import java.util.EnumMap;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Counts dropped relationships per {@link SkipReason}. Counts cover the
 * latest inference run only.
 */
@Log4j2
public class SkipCountingListener implements InferenceListener {
    private final boolean logEachSkip;
    private final Map<SkipReason, Long> counts = new EnumMap<>(SkipReason.class);
    private long totalRuns;

    public SkipCountingListener() {
        this(false);
    }

    public SkipCountingListener(boolean logEachSkip) {
        this.logEachSkip = logEachSkip;
    }

    @Override
    public synchronized void onInferenceStart(long run) {
        counts.clear();
    }

    @Override
    public synchronized void onRelationshipSkipped(long run, String source, String target, String type,
            SkipReason reason) {
        counts.merge(reason, 1L, Long::sum);
        if (logEachSkip)
            log.debug("Run {} skipped {} {} -> {} ({})", run, type, source, target, reason);
    }

    @Override
    public synchronized void onInferenceEnd(long run, int relationshipCount) {
        totalRuns++;
        if (logEachSkip && !counts.isEmpty())
            log.debug("Run {} kept {} relationships, skipped {}", run, relationshipCount, counts);
    }

    public synchronized long count(SkipReason reason) {
        return counts.getOrDefault(reason, 0L);
    }

    public synchronized long totalSkipped() {
        long n = 0;
        for (long c : counts.values())
            n += c;
        return n;
    }

    public synchronized long totalRuns() {
        return totalRuns;
    }

    public synchronized String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-22s | %10s%n", "Skip Reason", "Count"));
        sb.append("-----------------------------------\n");
        for (SkipReason r : SkipReason.values()) {
            sb.append(String.format("%-22s | %10d%n", r, count(r)));
        }
        return sb.toString();
    }
}
