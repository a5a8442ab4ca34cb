// file: server/src/main/java/io/admitq/server/CeilingRegistry.java
package io.admitq.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.admitq.core.ConcurrencyCeilingProvider;
import io.admitq.core.StorageException;
import io.admitq.core.ValidationException;
import io.admitq.server.dto.CeilingsFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Mutable, thread-safe table of concurrency limits.
 * <p>
 * Absent limit = unlimited. A configured limit must be {@code >= 1}.
 * <p>
 * JSON file layout:
 * <pre>
 *   {
 *     "orgs":   { "org-1": 5 },
 *     "agents": { "agent-1": 2 }
 *   }
 * </pre>
 * A registry loaded with {@link #fromJsonFile} writes every runtime change
 * back to that file (tmp + atomic move). If the write fails the change is
 * undone and a {@link StorageException} is thrown.
 */
public final class CeilingRegistry implements ConcurrencyCeilingProvider {
    private static final Logger log = Logger.getLogger(CeilingRegistry.class.getName());

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Integer> orgLimits = new ConcurrentHashMap<>();
    private final Map<String, Integer> agentLimits = new ConcurrentHashMap<>();
    private final Path file; // null = in-memory only

    public CeilingRegistry() {
        this(null);
    }

    private CeilingRegistry(Path file) {
        this.file = file;
    }

    public static CeilingRegistry fromJsonFile(Path path) {
        CeilingRegistry reg = new CeilingRegistry(path);
        try {
            CeilingsFile loaded = reg.mapper.readValue(path.toFile(), CeilingsFile.class);
            if (loaded.orgs != null) {
                loaded.orgs.forEach((id, max) -> put(reg.orgLimits, "orgId", id, max));
            }
            if (loaded.agents != null) {
                loaded.agents.forEach((id, max) -> put(reg.agentLimits, "agentId", id, max));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to load ceilings from " + path, e);
        }
        log.info(() -> String.format("loaded %d org and %d agent ceilings from %s",
                reg.orgLimits.size(), reg.agentLimits.size(), path));
        return reg;
    }

    @Override
    public OptionalInt orgCeiling(String orgId) {
        return lookup(orgLimits, orgId);
    }

    @Override
    public OptionalInt agentCeiling(String agentId) {
        return lookup(agentLimits, agentId);
    }

    /** Set (or clear, with null) the org limit. */
    public void setOrgCeiling(String orgId, Integer max) {
        update(orgLimits, "orgId", orgId, max);
    }

    /** Set (or clear, with null) the agent limit. */
    public void setAgentCeiling(String agentId, Integer max) {
        update(agentLimits, "agentId", agentId, max);
    }

    private static OptionalInt lookup(Map<String, Integer> m, String id) {
        Integer v = id == null ? null : m.get(id);
        return v == null ? OptionalInt.empty() : OptionalInt.of(v);
    }

    private synchronized void update(Map<String, Integer> m, String field, String id, Integer max) {
        Integer previous = put(m, field, id, max);
        if (file == null) {
            return;
        }
        try {
            save();
        } catch (StorageException e) {
            if (previous == null) {
                m.remove(id);
            } else {
                m.put(id, previous);
            }
            throw e;
        }
    }

    /** Validate and apply one change; returns the previous limit. */
    private static Integer put(Map<String, Integer> m, String field, String id, Integer max) {
        Objects.requireNonNull(id, field);
        if (id.isBlank()) {
            throw new ValidationException(field + " must not be empty");
        }
        if (max == null) {
            return m.remove(id);
        }
        if (max < 1) {
            throw new ValidationException("concurrency limit for " + id + " must be >= 1, got " + max);
        }
        return m.put(id, max);
    }

    private void save() {
        CeilingsFile out = new CeilingsFile();
        out.orgs = new TreeMap<>(orgLimits);
        out.agents = new TreeMap<>(agentLimits);
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), out);
            Files.move(tmp, file, REPLACE_EXISTING, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new StorageException("Failed to save ceilings to " + file, e);
        }
    }
}
