package com.testflow.testflow_runner.service;

import com.testflow.testflow_runner.config.TestflowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs started by this process. Active runs are always kept; of the finished ones only the
 * newest {@code testflow.runs.retain-finished} survive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunRegistry {

    private final TestflowProperties properties;
    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();

    public void register(RunHandle handle) {
        runs.put(handle.getRunId(), handle);
        evictFinished();
    }

    public Optional<RunHandle> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public List<RunHandle> all() {
        return runs.values().stream()
                .sorted(Comparator.comparing(RunHandle::getCreatedAt).reversed())
                .toList();
    }

    /** Called when a run ends as well as on every registration. */
    public synchronized void evictFinished() {
        int retain = Math.max(0, properties.getRuns().getRetainFinished());
        List<RunHandle> finished = all().stream()
                .filter(handle -> handle.getStatus().isFinished())
                .toList();
        for (RunHandle handle : finished.subList(Math.min(retain, finished.size()), finished.size())) {
            runs.remove(handle.getRunId());
            log.debug("Dropped finished run {} from the registry", handle.getRunId());
        }
    }
}
