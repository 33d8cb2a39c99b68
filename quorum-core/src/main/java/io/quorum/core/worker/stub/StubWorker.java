package io.quorum.core.worker.stub;

import io.quorum.core.partition.WorkUnit;
import io.quorum.core.roster.WorkerRole;
import io.quorum.core.worker.InvocationException;
import io.quorum.core.worker.PromptPayload;
import io.quorum.core.worker.Worker;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Worker that replays canned responses instead of calling a real analyst.
///
/// Used for dry runs and tests.
///
/// ### Response Resolution Order
/// 1. Programmatically registered responses for `{unitId}/{role}`, then `{role}`
/// 2. Filesystem: `{stubsDir}/{unitId}/{role}.txt`, then `{stubsDir}/{role}.txt`
/// 3. Classpath: `/stubs/{unitId}/{role}.txt`, then `/stubs/{role}.txt`
/// 4. A well-formed empty report (`{"findings": []}`)
///
/// @implNote Thread-safe. Filesystem and classpath lookups are cached.
public class StubWorker implements Worker {

    private static final Logger logger = Logger.getLogger(StubWorker.class.getName());
    private static final String STUB_RESOURCE_BASE = "/stubs/";
    static final String EMPTY_REPORT = "{\"findings\": []}";

    private final Map<String, String> registered = new ConcurrentHashMap<>();
    private final Map<String, String> cache = new ConcurrentHashMap<>();
    private final Path stubsDirectory;

    public StubWorker() {
        this(null);
    }

    /// @param stubsDirectory directory to search for stub files, may be null
    public StubWorker(Path stubsDirectory) {
        this.stubsDirectory = stubsDirectory;
    }

    /// Registers a response for a role on every unit.
    public StubWorker respond(WorkerRole role, String response) {
        registered.put(role.id(), response);
        return this;
    }

    /// Registers a response for a role on a single unit.
    public StubWorker respond(String unitId, WorkerRole role, String response) {
        registered.put(unitId + "/" + role.id(), response);
        return this;
    }

    @Override
    public String invoke(WorkUnit unit, WorkerRole role, PromptPayload payload)
            throws InvocationException {
        String unitKey = unit.id() + "/" + role.id();
        String response = registered.get(unitKey);
        if (response == null) {
            response = registered.get(role.id());
        }
        if (response == null) {
            response = lookup(unitKey);
        }
        if (response == null) {
            response = lookup(role.id());
        }
        if (response == null) {
            logger.fine("[STUB] No stub for " + unitKey + ", returning empty report");
            return EMPTY_REPORT;
        }
        logger.fine("[STUB] Serving stub for " + unitKey);
        return response;
    }

    private String lookup(String key) throws InvocationException {
        String cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        String loaded = loadFromFilesystem(key);
        if (loaded == null) {
            loaded = loadFromClasspath(key);
        }
        if (loaded != null) {
            cache.put(key, loaded);
        }
        return loaded;
    }

    private String loadFromFilesystem(String key) throws InvocationException {
        if (stubsDirectory == null) {
            return null;
        }
        Path file = stubsDirectory.resolve(key + ".txt");
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvocationException("Failed to read stub " + file, false, e);
        }
    }

    private String loadFromClasspath(String key) throws InvocationException {
        try (InputStream is = StubWorker.class.getResourceAsStream(STUB_RESOURCE_BASE + key + ".txt")) {
            if (is == null) {
                return null;
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvocationException("Failed to read stub resource " + key, false, e);
        }
    }
}
