/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.foreststate.storage;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.foreststate.ForestStateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File-based implementation of {@link ProjectFileStore}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * dataDir/
 *  ├─ .forest.lock                  // exclusive process lock
 *  ├─ dialogues.db                  // session store (not managed here)
 *  └─ &lt;projectId&gt;/
 *      ├─ config.json
 *      ├─ hta.json
 *      ├─ hta.json.tmp              // only while a write is in flight
 *      └─ paths/&lt;pathName&gt;/hta.json
 * </pre>
 * <p>
 * <b>Write protocol</b> ({@link #write}):
 * <ol>
 *   <li>invalidate the cache entry</li>
 *   <li>write {@code <name>.tmp}, fsync it</li>
 *   <li>atomic rename onto {@code <name>}, fsync the directory</li>
 *   <li>invalidate the cache entry again</li>
 * </ol>
 * The rename is the commit point. A failure before it removes the temp file and
 * leaves the previous value in place; a failure after it leaves the new value.
 * <p>
 * <b>Thread Safety:</b>
 * All I/O runs on a fixed pool of daemon threads. Reads may run concurrently with
 * anything; writes to one key must be serialized by the caller, which is what
 * {@link dev.mars.foreststate.serial.ProjectOperationSerializer} provides per project.
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> an exclusive lock on {@code .forest.lock} makes a second
 *       process fail fast on open. It detects misuse; it does not coordinate writers.</li>
 *   <li><b>Disk Space Checking:</b> pre-flight check before every write.</li>
 *   <li><b>Stale Temp Recovery:</b> temp files left by a crash are removed on open.</li>
 *   <li><b>Read-After-Write Verification:</b> optional comparison of the committed
 *       bytes with what was written.</li>
 * </ul>
 *
 * @see ProjectFileStore
 */
public final class AtomicFileStore implements ProjectFileStore {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicFileStore.class);

    /** Lock file name */
    private static final String LOCK_FILE = ".forest.lock";

    private final ForestStateConfig config;
    private final DocumentCache cache;
    private final DocumentCodec codec;
    private final WriteHook hook;
    private final Map<String, DocumentValidator> validators = new ConcurrentHashMap<>();
    private final ExecutorService ioExecutor;
    private final Path dataDir;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int maxDocumentSize;
    private final long minFreeSpace;

    private final Object lifecycle = new Object();
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private volatile boolean opened = false;
    private volatile boolean closed = false;

    /**
     * Creates a store with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     */
    public AtomicFileStore() {
        this(ForestStateConfig.load());
    }

    public AtomicFileStore(ForestStateConfig config) {
        this(config, new DocumentCache(), new DocumentCodec());
    }

    public AtomicFileStore(ForestStateConfig config, DocumentCache cache, DocumentCodec codec) {
        this(config, cache, codec, WriteHook.NONE);
    }

    AtomicFileStore(ForestStateConfig config, DocumentCache cache, DocumentCodec codec, WriteHook hook) {
        this.config = Objects.requireNonNull(config, "config");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.hook = Objects.requireNonNull(hook, "hook");
        this.dataDir = config.dataDir();
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.maxDocumentSize = config.maxDocumentSizeBytes();
        this.minFreeSpace = config.minFreeSpaceBytes();

        AtomicInteger threadCount = new AtomicInteger();
        this.ioExecutor = Executors.newFixedThreadPool(config.ioThreads(), r -> {
            Thread t = new Thread(r, "forest-io-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        validators.put(ProjectFiles.HTA, DocumentValidator.objectWithFields());

        LOG.info("AtomicFileStore initialized: dataDir={}, syncEnabled={}, verifyWrites={}, maxDocumentSize={} MB, ioThreads={}",
                dataDir, syncEnabled, verifyWrites, config.maxDocumentSizeMb(), config.ioThreads());
        if (!syncEnabled) {
            LOG.warn("AtomicFileStore created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /** The cache this store keeps coherent. */
    public DocumentCache cache() {
        return cache;
    }

    /** The codec used to encode documents. */
    public DocumentCodec codec() {
        return codec;
    }

    public ForestStateConfig config() {
        return config;
    }

    /**
     * Registers a validator for every document with the given file name,
     * replacing any previous one.
     */
    public void registerValidator(String fileName, DocumentValidator validator) {
        validators.put(Identifiers.requireRelativePath(fileName), Objects.requireNonNull(validator, "validator"));
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public CompletableFuture<Void> open() {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Store is closed"));
        }
        return CompletableFuture.runAsync(() -> {
            synchronized (lifecycle) {
                if (opened) {
                    LOG.debug("Store already open, ignoring duplicate open()");
                    return;
                }
                if (closed) {
                    throw new StorageException("Store is closed");
                }
                try {
                    LOG.info("Opening document store at: {}", dataDir);
                    Files.createDirectories(dataDir);
                    acquireExclusiveLock();
                    checkDiskSpace();
                    int removed = removeStaleTempFiles();
                    if (removed > 0) {
                        LOG.warn("Removed {} stale temp file(s) left by an interrupted write", removed);
                    }
                    opened = true;
                    LOG.info("Document store opened: {}", dataDir);
                } catch (IOException e) {
                    LOG.error("Failed to open document store at {}: {}", dataDir, e.getMessage(), e);
                    releaseExclusiveLock();
                    throw new DurabilityException("Failed to open document store at " + dataDir, e);
                } catch (RuntimeException e) {
                    releaseExclusiveLock();
                    throw e;
                }
            }
        }, ioExecutor);
    }

    @Override
    public void close() {
        synchronized (lifecycle) {
            if (closed) {
                LOG.debug("Store already closed, ignoring duplicate close()");
                return;
            }
            closed = true;
            opened = false;
        }
        LOG.info("Closing document store at: {}", dataDir);
        ioExecutor.shutdown();
        try {
            if (!ioExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("I/O tasks still running after 5s, forcing shutdown");
                ioExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ioExecutor.shutdownNow();
        }
        synchronized (lifecycle) {
            releaseExclusiveLock();
        }
        LOG.info("Document store closed");
    }

    // ========================================================================
    // Reads
    // ========================================================================

    @Override
    public CompletableFuture<Optional<JsonNode>> read(StorageKey key) {
        Objects.requireNonNull(key, "key");
        Optional<JsonNode> cached = cache.get(key);
        if (cached.isPresent()) {
            LOG.trace("Cache hit: {}", key);
            return CompletableFuture.completedFuture(cached);
        }
        return submit(() -> {
            long observedEpoch = cache.epoch();
            Optional<JsonNode> committed = readCommitted(key);
            committed.ifPresent(document -> cache.populate(key, document, observedEpoch));
            LOG.debug("Loaded {} from disk (present={})", key, committed.isPresent());
            return committed;
        });
    }

    @Override
    public CompletableFuture<Optional<JsonNode>> readDurable(StorageKey key) {
        Objects.requireNonNull(key, "key");
        return submit(() -> readCommitted(key));
    }

    @Override
    public CompletableFuture<Optional<StoredFile>> describe(StorageKey key) {
        Objects.requireNonNull(key, "key");
        return submit(() -> {
            Path target = resolve(key);
            try {
                BasicFileAttributes attrs = Files.readAttributes(target, BasicFileAttributes.class);
                return Optional.of(new StoredFile(key, attrs.size(), attrs.lastModifiedTime().toInstant()));
            } catch (NoSuchFileException | NotDirectoryException e) {
                return Optional.empty();
            } catch (IOException e) {
                throw new DurabilityException("Failed to stat " + key, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listProjectFiles(String projectId) {
        Identifiers.requireProjectId(projectId);
        return submit(() -> {
            Path projectDir = projectDir(projectId);
            if (!Files.isDirectory(projectDir)) {
                return List.of();
            }
            try (Stream<Path> files = Files.walk(projectDir)) {
                return files.filter(Files::isRegularFile)
                        .filter(p -> !p.getFileName().toString().endsWith(Identifiers.TEMP_SUFFIX))
                        .map(p -> toRelativePath(projectDir, p))
                        .sorted()
                        .collect(Collectors.toList());
            } catch (IOException e) {
                throw new DurabilityException("Failed to list files of project " + projectId, e);
            }
        });
    }

    // ========================================================================
    // Writes
    // ========================================================================

    @Override
    public CompletableFuture<Void> write(StorageKey key, JsonNode document) {
        Objects.requireNonNull(key, "key");
        byte[] encoded;
        try {
            encoded = prepare(key, document);
        } catch (ValidationException e) {
            LOG.warn("Rejected write to {}: {}", key, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        return submit(() -> {
            // Phase 1: no reader may cache the value that is about to be replaced
            cache.invalidate(key);
            try {
                commit(key, encoded);
            } finally {
                // Phase 2: drop anything a reader cached while the rename was in flight
                cache.invalidate(key);
            }
            LOG.debug("Committed {} ({} bytes)", key, encoded.length);
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> delete(StorageKey key) {
        Objects.requireNonNull(key, "key");
        return submit(() -> {
            Path target = resolve(key);
            cache.invalidate(key);
            try {
                boolean existed = Files.deleteIfExists(target);
                if (existed && syncEnabled) {
                    syncDirectory(target.getParent());
                }
                LOG.debug("Deleted {} (existed={})", key, existed);
                return existed;
            } catch (IOException e) {
                LOG.error("Failed to delete {}: {}", key, e.getMessage(), e);
                throw new DurabilityException("Failed to delete " + key, e);
            } finally {
                cache.invalidate(key);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> deleteProject(String projectId) {
        Identifiers.requireProjectId(projectId);
        return submit(() -> {
            Path projectDir = projectDir(projectId);
            cache.invalidateProject(projectId);
            try {
                if (!Files.exists(projectDir)) {
                    LOG.warn("Project directory not found during deletion: {}", projectDir);
                    return false;
                }
                List<Path> paths;
                try (Stream<Path> walk = Files.walk(projectDir)) {
                    paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
                }
                for (Path path : paths) {
                    Files.deleteIfExists(path);
                }
                if (syncEnabled) {
                    syncDirectory(dataDir);
                }
                LOG.info("Project deleted: {} ({} entries removed)", projectId, paths.size());
                return true;
            } catch (IOException e) {
                LOG.error("Failed to delete project {}: {}", projectId, e.getMessage(), e);
                throw new DurabilityException("Failed to delete project " + projectId, e);
            } finally {
                cache.invalidateProject(projectId);
            }
        });
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Validates and encodes a document. Runs on the caller's thread, before any I/O.
     */
    private byte[] prepare(StorageKey key, JsonNode document) {
        if (document == null || document.isMissingNode()) {
            throw new ValidationException("Document for " + key + " must not be null");
        }
        projectDir(key.projectId());
        DocumentValidator validator = validators.get(key.fileName());
        if (validator != null) {
            validator.validate(key, document);
        }
        byte[] encoded = codec.encode(document);
        if (encoded.length > maxDocumentSize) {
            throw new ValidationException("Document too large for " + key + ": " + encoded.length +
                    " bytes (max: " + maxDocumentSize + ")");
        }
        return encoded;
    }

    /**
     * Writes the temp file and renames it onto the target.
     * Must be called from an I/O thread.
     */
    private void commit(StorageKey key, byte[] encoded) {
        Path target = resolve(key);
        Path tmpPath = target.resolveSibling(target.getFileName() + Identifiers.TEMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            checkDiskSpace();

            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(encoded);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced temp file {}", tmpPath);
                }
            }

            hook.beforeRename(key, tmpPath);

            // Atomic rename: the commit point
            Files.move(tmpPath, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmpPath, target);
        } catch (IOException | RuntimeException e) {
            deleteTempFile(tmpPath);
            LOG.error("Failed to write {}: {}", key, e.getMessage(), e);
            if (e instanceof StorageException) {
                throw (StorageException) e;
            }
            throw new DurabilityException("Failed to write " + key, e);
        }

        try {
            hook.afterRename(key, target);
            if (syncEnabled) {
                syncDirectory(target.getParent());
            }
            if (verifyWrites) {
                verifyWrittenDocument(key, target, encoded);
            }
        } catch (IOException e) {
            LOG.error("Post-commit step failed for {} (new value is committed): {}", key, e.getMessage(), e);
            throw new DurabilityException("Post-commit step failed for " + key, e);
        }
    }

    private Optional<JsonNode> readCommitted(StorageKey key) {
        Path target = resolve(key);
        byte[] bytes;
        // A parent path that is a file, or a target that is a directory, holds no document
        if (Files.isDirectory(target)) {
            LOG.trace("No committed value for {} (directory)", key);
            return Optional.empty();
        }
        try {
            bytes = Files.readAllBytes(target);
        } catch (NoSuchFileException | NotDirectoryException e) {
            LOG.trace("No committed value for {}", key);
            return Optional.empty();
        } catch (IOException e) {
            LOG.error("Failed to read {}: {}", key, e.getMessage(), e);
            throw new DurabilityException("Failed to read " + key, e);
        }
        try {
            return Optional.of(codec.decode(bytes));
        } catch (IOException e) {
            LOG.error("Corrupt document at {}: {}", target, e.getMessage());
            throw new CorruptDocumentException(key, e);
        }
    }

    private Path projectDir(String projectId) {
        String dbFile = config.sessionDbFile();
        if (projectId.equals(dbFile) || projectId.startsWith(dbFile + "-")) {
            throw new ValidationException("projectId collides with the session database: " + projectId);
        }
        return dataDir.resolve(projectId);
    }

    private Path resolve(StorageKey key) {
        Path path = projectDir(key.projectId());
        for (String segment : key.relativePath().split("/")) {
            path = path.resolve(segment);
        }
        return path;
    }

    private static String toRelativePath(Path projectDir, Path file) {
        Path relative = projectDir.relativize(file);
        List<String> segments = new ArrayList<>();
        for (Path segment : relative) {
            segments.add(segment.toString());
        }
        return String.join("/", segments);
    }

    private <T> CompletableFuture<T> submit(IoTask<T> task) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Store is closed"));
        }
        if (!opened) {
            return CompletableFuture.failedFuture(new StorageException("Store is not open"));
        }
        return CompletableFuture.supplyAsync(task::run, ioExecutor);
    }

    @FunctionalInterface
    private interface IoTask<T> {
        T run();
    }

    private void deleteTempFile(Path tmpPath) {
        try {
            if (Files.deleteIfExists(tmpPath)) {
                LOG.debug("Removed temp file after failed write: {}", tmpPath);
            }
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", tmpPath, e.getMessage());
        }
    }

    private int removeStaleTempFiles() throws IOException {
        List<Path> stale;
        try (Stream<Path> walk = Files.walk(dataDir)) {
            stale = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(Identifiers.TEMP_SUFFIX))
                    .collect(Collectors.toList());
        }
        for (Path path : stale) {
            LOG.warn("Removing stale temp file: {}", path);
            Files.deleteIfExists(path);
        }
        return stale.size();
    }

    /**
     * Fsyncs a directory to ensure metadata changes (renames) are durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     * On Linux (ext4/xfs), this is critical for durability.
     */
    private void syncDirectory(Path dir) {
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Acquires an exclusive lock on the data directory to detect a second process.
     *
     * @throws StorageException if the lock is held elsewhere
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on data directory: " + dataDir +
                        ". Another process may be using this storage.");
            }
            LOG.info("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock: lock already held in this JVM", e);
        }
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel: {}", e.getMessage());
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws DurabilityException if disk space is below the minimum threshold
     */
    private void checkDiskSpace() throws IOException {
        if (minFreeSpace <= 0) {
            return;
        }
        FileStore store = Files.getFileStore(dataDir);
        long usableSpace = store.getUsableSpace();
        if (usableSpace < minFreeSpace) {
            long usableSpaceMb = usableSpace / 1024 / 1024;
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, config.minFreeSpaceMb());
            throw new DurabilityException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + config.minFreeSpaceMb() + " MB");
        }
    }

    /**
     * Reads the committed file back and compares it with what was written.
     * Detects filesystems that acknowledge writes they did not persist.
     */
    private void verifyWrittenDocument(StorageKey key, Path target, byte[] expected) throws IOException {
        byte[] actual = Files.readAllBytes(target);
        if (!Arrays.equals(expected, actual)) {
            LOG.error("Write verification failed for {}: wrote {} bytes, read back {} bytes",
                    key, expected.length, actual.length);
            throw new DurabilityException("Write verification failed for " + key +
                    ": committed bytes differ from written bytes");
        }
        LOG.trace("Write verification passed for {}", key);
    }
}
