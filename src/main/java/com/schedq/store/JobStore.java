package com.schedq.store;

import java.util.List;
import java.util.Optional;

/**
 * Save/load collaborator for {@link JobState}. Implementations must tolerate concurrent
 * calls for different codes.
 */
public interface JobStore {

    void save(JobState state);

    Optional<JobState> load(String code);

    void delete(String code);

    List<JobState> loadAll();
}
