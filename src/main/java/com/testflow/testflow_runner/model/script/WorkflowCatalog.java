package com.testflow.testflow_runner.model.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named sub-workflow blocks of a script file. A name may appear several times; the
 * instances are kept in file order and calls use the first one.
 */
public class WorkflowCatalog {

    private final Map<String, List<Workflow>> workflows = new LinkedHashMap<>();
    private final boolean caseSensitive;

    public WorkflowCatalog(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
    }

    public static WorkflowCatalog empty() {
        return new WorkflowCatalog(true);
    }

    public void add(Workflow workflow) {
        workflows.computeIfAbsent(key(workflow.name()), k -> new ArrayList<>()).add(workflow);
    }

    public Optional<Workflow> first(String name) {
        List<Workflow> instances = workflows.get(key(name));
        return instances == null || instances.isEmpty() ? Optional.empty() : Optional.of(instances.get(0));
    }

    public List<Workflow> instances(String name) {
        return Collections.unmodifiableList(workflows.getOrDefault(key(name), List.of()));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(workflows.keySet());
    }

    public boolean contains(String name) {
        return workflows.containsKey(key(name));
    }

    public boolean isEmpty() {
        return workflows.isEmpty();
    }

    /** Own blocks first, then every name of {@code parent} this catalog does not define. */
    public WorkflowCatalog mergedWith(WorkflowCatalog parent) {
        WorkflowCatalog merged = new WorkflowCatalog(caseSensitive);
        workflows.values().forEach(list -> list.forEach(merged::add));
        if (parent != null) {
            parent.workflows.forEach((name, list) -> {
                if (!merged.contains(name)) {
                    list.forEach(merged::add);
                }
            });
        }
        return merged;
    }

    private String key(String name) {
        String trimmed = name == null ? "" : name.trim();
        return caseSensitive ? trimmed : trimmed.toLowerCase(Locale.ROOT);
    }
}
