package com.schedq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Code to definition lookup. Reads work on an immutable snapshot and never block;
 * writes are serialized and publish a new snapshot.
 */
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private volatile Map<String, JobDefinition> definitions = Map.of();

    /**
     * Registers a definition and, for a multi-trigger definition, its sub-jobs.
     *
     * @return the definition's code
     * @throws IllegalStateException if the code or one of its sub-job codes is taken
     */
    public synchronized String register(JobDefinition definition) {
        List<JobDefinition> family = new ArrayList<>();
        family.add(definition);
        family.addAll(definition.subJobs());

        for (JobDefinition member : family) {
            if (definitions.containsKey(member.getCode())) {
                throw new IllegalStateException(
                        "Duplicate job code '" + member.getCode() + "'. Each job code must be unique.");
            }
        }

        Map<String, JobDefinition> updated = new LinkedHashMap<>(definitions);
        for (JobDefinition member : family) {
            updated.put(member.getCode(), member);
        }
        publish(updated);
        log.debug("Registered job {} with {} trigger(s)", definition.getCode(), definition.getTriggers().size());
        return definition.getCode();
    }

    /**
     * Replaces the definition stored under the same code. Sub-jobs of a multi-trigger
     * definition are not touched.
     */
    public synchronized void replace(JobDefinition definition) {
        if (!definitions.containsKey(definition.getCode())) {
            throw new JobNotFoundException(definition.getCode());
        }
        Map<String, JobDefinition> updated = new LinkedHashMap<>(definitions);
        updated.put(definition.getCode(), definition);
        publish(updated);
    }

    /**
     * Removes a definition together with its sub-jobs.
     *
     * @return the removed definitions, empty if the code was unknown
     */
    /**
     * Removes a job and its sub-jobs.
     *
     * @return the removed definitions, empty if {@code code} was not registered
     * @throws IllegalStateException if {@code code} names a sub-job, which only leaves with its parent
     */
    public synchronized List<JobDefinition> unregister(String code) {
        JobDefinition definition = definitions.get(code);
        if (definition == null) {
            return List.of();
        }
        if (definition.getParentCode().isPresent()) {
            throw new IllegalStateException("Sub-job " + code + " cannot be removed on its own; remove job "
                    + definition.getParentCode().get() + " instead");
        }
        List<JobDefinition> removed = new ArrayList<>();
        Map<String, JobDefinition> updated = new LinkedHashMap<>(definitions);
        removed.add(updated.remove(code));
        for (String subCode : subJobCodes(code)) {
            removed.add(updated.remove(subCode));
        }
        publish(updated);
        return removed;
    }

    public JobDefinition get(String code) {
        JobDefinition definition = definitions.get(code);
        if (definition == null) {
            throw new JobNotFoundException(code);
        }
        return definition;
    }

    public Optional<JobDefinition> find(String code) {
        return Optional.ofNullable(definitions.get(code));
    }

    public boolean contains(String code) {
        return definitions.containsKey(code);
    }

    /**
     * Every registered entry, parents and sub-jobs, in registration order.
     */
    public List<JobDefinition> getDefinitions() {
        return List.copyOf(definitions.values());
    }

    /**
     * Entries the scheduler evaluates triggers for: single-trigger definitions and sub-jobs.
     */
    public List<JobDefinition> getSchedulableDefinitions() {
        return definitions.values().stream()
                .filter(definition -> !definition.isMultiTrigger())
                .toList();
    }

    public List<String> subJobCodes(String parentCode) {
        return definitions.values().stream()
                .filter(definition -> definition.getParentCode().filter(parentCode::equals).isPresent())
                .map(JobDefinition::getCode)
                .toList();
    }

    public int size() {
        return definitions.size();
    }

    private void publish(Map<String, JobDefinition> updated) {
        this.definitions = Collections.unmodifiableMap(updated);
    }
}
