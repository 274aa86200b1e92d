package com.schedq.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps all job states in one JSON document, rewritten on every change through a
 * temporary file and an atomic move.
 */
public class JsonFileJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileJobStore.class);
    private static final TypeReference<Map<String, JobState>> STATES_TYPE = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Map<String, JobState> states;

    public JsonFileJobStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.states = read();
    }

    private Map<String, JobState> read() {
        if (!Files.exists(path)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, JobState> loaded = objectMapper.readValue(path.toFile(), STATES_TYPE);
            log.info("Loaded {} job state(s) from {}", loaded.size(), path);
            return new LinkedHashMap<>(loaded);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read job store " + path, e);
        }
    }

    @Override
    public synchronized void save(JobState state) {
        states.put(state.code(), state);
        write();
    }

    @Override
    public synchronized Optional<JobState> load(String code) {
        return Optional.ofNullable(states.get(code));
    }

    @Override
    public synchronized void delete(String code) {
        if (states.remove(code) != null) {
            write();
        }
    }

    @Override
    public synchronized List<JobState> loadAll() {
        return List.copyOf(states.values());
    }

    private void write() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), states);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write job store " + path, e);
        }
    }
}
