package com.themis.refinery.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.themis.refinery.api.RulePersistence;
import com.themis.refinery.api.exception.PersistenceException;
import com.themis.refinery.api.model.RuleSetVersion;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Stores rule-set snapshots as JSON files.
 *
 * <pre>
 * &lt;directory&gt;/rules-latest.json          current snapshot
 * &lt;directory&gt;/versions/&lt;version&gt;.json   every saved version
 * </pre>
 *
 * Files are written to a temporary sibling and moved into place, so a crash
 * never leaves a half-written snapshot behind.
 */
public final class JsonFileRulePersistence implements RulePersistence {
    private static final Logger logger = Logger.getLogger(JsonFileRulePersistence.class.getName());

    private static final String LATEST_FILE = "rules-latest.json";
    private static final String VERSIONS_DIR = "versions";
    private static final Pattern SAFE_VERSION = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileRulePersistence(Path directory) {
        this(directory, JsonMappers.create());
    }

    public JsonFileRulePersistence(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<RuleSetVersion> loadLatestVersion() throws PersistenceException {
        return read(directory.resolve(LATEST_FILE));
    }

    @Override
    public synchronized void saveVersion(RuleSetVersion snapshot) throws PersistenceException {
        try {
            Files.createDirectories(directory.resolve(VERSIONS_DIR));
            byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
            writeAtomically(versionFile(snapshot.version()), json);
            writeAtomically(directory.resolve(LATEST_FILE), json);
        } catch (IOException e) {
            throw new PersistenceException("Failed to save rule set " + snapshot.version()
                    + " to " + directory, e);
        }
    }

    @Override
    public synchronized Optional<RuleSetVersion> loadVersion(String version) throws PersistenceException {
        return read(versionFile(version));
    }

    private Optional<RuleSetVersion> read(Path file) throws PersistenceException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), RuleSetVersion.class));
        } catch (IOException e) {
            throw new PersistenceException("Failed to read rule set from " + file, e);
        }
    }

    private Path versionFile(String version) throws PersistenceException {
        if (!SAFE_VERSION.matcher(version).matches()) {
            throw new PersistenceException("Illegal version label: " + version);
        }
        return directory.resolve(VERSIONS_DIR).resolve(version + ".json");
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(temp, content);
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move not supported for " + target + ", falling back to plain replace");
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
