package com.alertengine.metric;

import com.alertengine.domain.model.MetricSample;
import com.alertengine.engine.AlertEngineConfig;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded, per-metric, insertion-ordered sample history.
 *
 * <p>Each metric owns an {@link ArrayDeque} capped at {@code metricHistoryCapacity}; once the
 * cap is exceeded the oldest samples are evicted first. Each deque is guarded by its own
 * monitor so different metrics never contend with each other.
 *
 * <p>Window queries walk backwards from the newest sample and stop at the first sample older
 * than the window start, so their cost is proportional to the window, not the history.
 */
@Component
public class MetricStore {

    private static final Logger log = LoggerFactory.getLogger(MetricStore.class);

    private final int capacity;
    private final Map<String, Deque<MetricSample>> histories = new ConcurrentHashMap<>();

    @Autowired
    public MetricStore(AlertEngineConfig alertEngineConfig) {
        this(alertEngineConfig.getMetricHistoryCapacity());
    }

    public MetricStore(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Metric history capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Appends a sample to its metric's history and trims the history to capacity.
     */
    public void record(MetricSample sample) {
        Deque<MetricSample> history = histories.computeIfAbsent(sample.getMetric(), k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(sample);
            while (history.size() > capacity) {
                history.removeFirst();
            }
        }
    }

    /**
     * Returns the contiguous suffix of the metric's history whose timestamps are at or after
     * {@code since}, oldest first. Empty if the metric has no samples in the window.
     */
    public List<MetricSample> samplesInWindow(String metric, Instant since) {
        Deque<MetricSample> history = histories.get(metric);
        if (history == null) {
            return List.of();
        }

        List<MetricSample> window = new ArrayList<>();
        synchronized (history) {
            Iterator<MetricSample> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext()) {
                MetricSample sample = newestFirst.next();
                if (sample.getTimestamp().isBefore(since)) {
                    break;
                }
                window.add(sample);
            }
        }
        Collections.reverse(window);
        return window;
    }

    public Optional<MetricSample> latest(String metric) {
        Deque<MetricSample> history = histories.get(metric);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            return Optional.ofNullable(history.peekLast());
        }
    }

    public int historySize(String metric) {
        Deque<MetricSample> history = histories.get(metric);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    public Set<String> metricNames() {
        return new TreeSet<>(histories.keySet());
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Drops samples older than {@code cutoff} from every history. Empty histories are kept so a
     * concurrent {@link #record} never appends to a detached deque.
     *
     * @return number of samples removed
     */
    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        for (Deque<MetricSample> history : histories.values()) {
            synchronized (history) {
                while (!history.isEmpty() && history.peekFirst().getTimestamp().isBefore(cutoff)) {
                    history.removeFirst();
                    removed++;
                }
            }
        }
        if (removed > 0) {
            log.debug("Purged {} metric samples older than {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * Copies every history for export. The returned lists are detached from the store.
     */
    public Map<String, List<MetricSample>> snapshot() {
        Map<String, List<MetricSample>> copy = new LinkedHashMap<>();
        for (String metric : metricNames()) {
            Deque<MetricSample> history = histories.get(metric);
            if (history != null) {
                synchronized (history) {
                    copy.put(metric, List.copyOf(history));
                }
            }
        }
        return copy;
    }
}
