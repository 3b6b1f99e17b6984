package com.operatorsedge.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Lock-protected, atomically replaced JSON documents in a single state directory.
 * <p>
 * Every mutation runs as read-modify-write under an exclusive lock on
 * {@code <file>.lock}. The lock is taken in two layers: a per-path
 * {@link ReentrantLock} for threads of this JVM (the OS lock is held per process
 * and would otherwise throw {@code OverlappingFileLockException}) and a
 * {@link FileLock} for other processes. Writes go to a temp file in the same
 * directory which is forced to disk and renamed over the target, so readers
 * never observe a partially written document.
 * <p>
 * A missing or unparseable file reads as the caller's default shape; the next
 * successful write replaces it.
 */
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private static final ConcurrentHashMap<Path, ReentrantLock> IN_PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path directory;
    private final ObjectMapper mapper;
    private final Duration lockTimeout;
    private final long pollMillis;

    public StateStore(Path directory, ObjectMapper mapper, Duration lockTimeout, long pollMillis) {
        this.directory = directory;
        this.mapper = mapper;
        this.lockTimeout = lockTimeout;
        this.pollMillis = Math.max(1, pollMillis);
    }

    public Path getDirectory() {
        return directory;
    }

    public Path resolve(String fileName) {
        return directory.resolve(fileName);
    }

    public boolean exists(String fileName) {
        return Files.isRegularFile(resolve(fileName));
    }

    /**
     * Reads without taking the lock. Only for callers that tolerate a slightly stale view,
     * such as status displays.
     */
    public <T> T read(String fileName, Class<T> type, Supplier<T> defaults) {
        return load(fileName, type, defaults).value();
    }

    /**
     * Reads without taking the lock and reports whether the file was valid, missing or corrupt.
     */
    public <T> LoadedState<T> inspect(String fileName, Class<T> type, Supplier<T> defaults) {
        return load(fileName, type, defaults);
    }

    /**
     * Reads under the lock. Use when the result decides a later write.
     */
    public <T> T readLocked(String fileName, Class<T> type, Supplier<T> defaults) {
        return withLock(fileName, () -> load(fileName, type, defaults).value());
    }

    /**
     * Loads the current value under the lock, applies {@code mutator} and persists the result.
     * Nothing is written when the mutator returns an equal value and the file on disk was valid.
     *
     * @return the value now on disk
     * @throws StateBusyException  if the lock could not be acquired in time
     * @throws StateStoreException if the file could not be written
     */
    public <T> T update(String fileName, Class<T> type, Supplier<T> defaults, UnaryOperator<T> mutator) {
        return withLock(fileName, () -> {
            LoadedState<T> current = load(fileName, type, defaults);
            T next = Objects.requireNonNull(mutator.apply(current.value()), "mutator returned null");
            if (current.isValid() && next.equals(current.value())) {
                return next;
            }
            writeAtomically(fileName, next);
            return next;
        });
    }

    /**
     * Replaces the file with {@code value} under the lock.
     */
    public <T> void write(String fileName, T value) {
        withLock(fileName, () -> {
            writeAtomically(fileName, value);
            return null;
        });
    }

    /**
     * Runs {@code action} while holding the exclusive lock for {@code fileName}.
     * Must not be nested for the same file.
     */
    public <R> R withLock(String fileName, Supplier<R> action) {
        Path lockPath = resolve(fileName + ".lock").toAbsolutePath().normalize();
        ReentrantLock local = IN_PROCESS_LOCKS.computeIfAbsent(lockPath, p -> new ReentrantLock());
        long deadline = System.nanoTime() + lockTimeout.toNanos();

        boolean held;
        try {
            held = local.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateBusyException(fileName, "Interrupted while waiting for lock on " + fileName);
        }
        if (!held) {
            log.warn("Lock on {} not acquired within {}ms", fileName, lockTimeout.toMillis());
            throw busy(fileName);
        }

        try {
            Files.createDirectories(directory);
            try (FileChannel channel = FileChannel.open(lockPath,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                FileLock fileLock = acquire(channel, fileName, deadline);
                try {
                    return action.get();
                } finally {
                    if (fileLock.isValid()) {
                        fileLock.release();
                    }
                }
            }
        } catch (IOException e) {
            throw new StateStoreException(fileName, "Failed to lock " + fileName + ": " + e.getMessage(), e);
        } finally {
            local.unlock();
        }
    }

    private FileLock acquire(FileChannel channel, String fileName, long deadline) throws IOException {
        while (true) {
            FileLock fileLock = channel.tryLock();
            if (fileLock != null) {
                return fileLock;
            }
            if (System.nanoTime() >= deadline) {
                log.warn("File lock on {} held by another process for more than {}ms",
                        fileName, lockTimeout.toMillis());
                throw busy(fileName);
            }
            try {
                Thread.sleep(pollMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StateBusyException(fileName, "Interrupted while waiting for lock on " + fileName);
            }
        }
    }

    private StateBusyException busy(String fileName) {
        return new StateBusyException(fileName,
                "State busy: " + fileName + " is locked by another invocation, retry");
    }

    private <T> LoadedState<T> load(String fileName, Class<T> type, Supplier<T> defaults) {
        Path path = resolve(fileName);
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return new LoadedState<>(defaults.get(), LoadedState.Status.MISSING, null);
        } catch (IOException e) {
            throw new StateStoreException(fileName, "Failed to read " + fileName + ": " + e.getMessage(), e);
        }

        try {
            T value = bytes.length == 0 ? null : mapper.readValue(bytes, type);
            if (value == null) {
                log.warn("State file {} is empty, falling back to defaults", fileName);
                return new LoadedState<>(defaults.get(), LoadedState.Status.CORRUPT, "empty file");
            }
            return new LoadedState<>(value, LoadedState.Status.VALID, null);
        } catch (IOException e) {
            log.warn("State file {} is corrupt, falling back to defaults: {}", fileName, e.getMessage());
            return new LoadedState<>(defaults.get(), LoadedState.Status.CORRUPT, e.getMessage());
        }
    }

    private void writeAtomically(String fileName, Object value) {
        Path target = resolve(fileName);
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StateStoreException(fileName, "Failed to serialize " + fileName + ": " + e.getMessage(), e);
        }

        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, fileName + ".", ".tmp");
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported in {}, using plain replace", directory);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} ({} bytes)", fileName, bytes.length);
        } catch (IOException e) {
            throw new StateStoreException(fileName, "Failed to write " + fileName + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }
}
