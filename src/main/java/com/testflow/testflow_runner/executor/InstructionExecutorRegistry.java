package com.testflow.testflow_runner.executor;

import com.testflow.testflow_runner.model.script.InstructionType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One executor per executable {@link InstructionType}. Startup fails when an executable type
 * has no executor, when two executors claim the same type or when one claims an inert type,
 * so dispatch never has to guess.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InstructionExecutorRegistry {

    private final List<InstructionExecutor> executors;
    private final Map<InstructionType, InstructionExecutor> byType = new EnumMap<>(InstructionType.class);

    @PostConstruct
    public void init() {
        for (InstructionExecutor executor : executors) {
            InstructionType type = executor.supportedType();
            if (type.isInert()) {
                throw new IllegalStateException(executor.getClass().getSimpleName() + " registered for inert type " + type);
            }
            InstructionExecutor previous = byType.putIfAbsent(type, executor);
            if (previous != null) {
                throw new IllegalStateException(type + " claimed by both " + previous.getClass().getSimpleName()
                        + " and " + executor.getClass().getSimpleName());
            }
        }
        Set<InstructionType> missing = EnumSet.noneOf(InstructionType.class);
        for (InstructionType type : InstructionType.values()) {
            if (!type.isInert() && !byType.containsKey(type)) {
                missing.add(type);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No executor registered for instruction types: " + missing);
        }
        log.info("Registered {} instruction executors", byType.size());
    }

    /** @throws UnsupportedOperationException for inert types, which are never dispatched */
    public InstructionExecutor get(InstructionType type) {
        InstructionExecutor executor = byType.get(type);
        if (executor == null) {
            throw new UnsupportedOperationException("No executor for instruction type: " + type);
        }
        return executor;
    }
}
