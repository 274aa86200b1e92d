package com.schedq.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryJobStore implements JobStore {

    private final Map<String, JobState> states = new ConcurrentHashMap<>();

    @Override
    public void save(JobState state) {
        states.put(state.code(), state);
    }

    @Override
    public Optional<JobState> load(String code) {
        return Optional.ofNullable(states.get(code));
    }

    @Override
    public void delete(String code) {
        states.remove(code);
    }

    @Override
    public List<JobState> loadAll() {
        return List.copyOf(states.values());
    }
}
