package com.oncall.core.learning;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.oncall.core.config.InvestigatorProperties;
import com.oncall.core.model.SessionLearning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps session learnings as a JSON array in a single file, retaining the most recent entries.
 * Writes go through a temporary file and a move, so a crash never leaves a half-written store.
 */
@Component
public class FileLearningStore implements LearningStore {

    private static final Logger log = LoggerFactory.getLogger(FileLearningStore.class);
    private static final TypeReference<List<SessionLearning>> SESSION_LIST = new TypeReference<>() {};

    private final Path path;
    private final int maxSessions;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Autowired
    public FileLearningStore(InvestigatorProperties properties) {
        this(Path.of(properties.getLearning().getStorePath()), properties.getLearning().getMaxSessions());
    }

    FileLearningStore(Path path, int maxSessions) {
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be at least 1, got " + maxSessions);
        }
        this.path = path;
        this.maxSessions = maxSessions;
    }

    @Override
    public synchronized List<SessionLearning> recent(int limit) {
        List<SessionLearning> all = readAll();
        int from = Math.max(0, all.size() - limit);
        return List.copyOf(all.subList(from, all.size()));
    }

    @Override
    public synchronized void append(SessionLearning session) {
        var sessions = new ArrayList<>(readAll());
        sessions.add(session);
        if (sessions.size() > maxSessions) {
            sessions = new ArrayList<>(sessions.subList(sessions.size() - maxSessions, sessions.size()));
        }
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), sessions);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}, using regular move", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Stored learnings for session {} ({} session(s) retained)", session.sessionId(), sessions.size());
        } catch (IOException e) {
            throw new LearningStoreException("Cannot write learning store " + path, e);
        }
    }

    private List<SessionLearning> readAll() {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            List<SessionLearning> sessions = objectMapper.readValue(path.toFile(), SESSION_LIST);
            return sessions != null ? sessions : List.of();
        } catch (IOException e) {
            throw new LearningStoreException("Cannot read learning store " + path, e);
        }
    }
}
