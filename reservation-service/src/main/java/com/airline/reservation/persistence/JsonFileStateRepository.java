package com.airline.reservation.persistence;

import com.airline.reservation.constants.ReservationConstants;
import com.airline.reservation.exception.StatePersistenceException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Stores the state as one pretty-printed JSON document.
 * Writes go to a sibling temp file which then replaces the target.
 */
@Repository
@Slf4j
public class JsonFileStateRepository implements StateRepository {

    private final ObjectMapper objectMapper;
    private final Path stateFile;
    private final Path tempFile;

    public JsonFileStateRepository(
            ObjectMapper objectMapper,
            @Value("${reservation.state.file:" + ReservationConstants.DEFAULT_STATE_FILE + "}") String stateFile) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        this.stateFile = Paths.get(stateFile).toAbsolutePath();
        this.tempFile = this.stateFile.resolveSibling(this.stateFile.getFileName() + ReservationConstants.TEMP_FILE_SUFFIX);
    }

    @Override
    public Optional<ReservationState> load() {
        if (!Files.exists(stateFile)) {
            log.info("No state file found at {}", stateFile);
            return Optional.empty();
        }

        try {
            ReservationState state = objectMapper.readValue(stateFile.toFile(), ReservationState.class);
            fillMissingSections(state);
            log.info("Loaded state from {}: flights={}, holds={}, purchases={}",
                    stateFile, state.getFlights().size(), state.getHolds().size(), state.getPurchases().size());
            return Optional.of(state);
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to read state file " + stateFile, e);
        }
    }

    @Override
    public void save(ReservationState state) {
        try {
            Path parent = stateFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tempFile.toFile(), state);
            replaceStateFile();
            log.debug("State written to {}", stateFile);
        } catch (IOException e) {
            throw new StatePersistenceException("Failed to write state file " + stateFile, e);
        }
    }

    private static void fillMissingSections(ReservationState state) {
        if (state.getFlights() == null) {
            state.setFlights(new LinkedHashMap<>());
        }
        if (state.getHolds() == null) {
            state.setHolds(new LinkedHashMap<>());
        }
        if (state.getPurchases() == null) {
            state.setPurchases(new LinkedHashMap<>());
        }
    }

    private void replaceStateFile() throws IOException {
        try {
            Files.move(tempFile, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", stateFile);
            Files.move(tempFile, stateFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
