package com.stockaid.cache;

import com.stockaid.codec.TableCsvCodec;
import com.stockaid.model.Endpoint;
import com.stockaid.model.Table;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;

/**
 * File-system backed response cache.
 * Layout: {@code <root>/<provider>/<api>/<identity>.csv}, freshness from the file's modification time.
 *
 * Caching is advisory: every file-system failure degrades to a miss or a skipped write, never an error.
 * Concurrent access to the same entry is not coordinated; the last writer wins.
 */
@Slf4j
public class FileCacheStore {

    private final TableCsvCodec codec;
    private final Clock clock;
    private final Set<PosixFilePermission> directoryPermissions;

    public FileCacheStore(TableCsvCodec codec, Clock clock, Set<PosixFilePermission> directoryPermissions) {
        this.codec = codec;
        this.clock = clock;
        this.directoryPermissions = directoryPermissions;
    }

    public FileCacheStore(TableCsvCodec codec, Clock clock) {
        this(codec, clock, null);
    }

    /**
     * Make sure {@code path} is a writable directory, creating it if needed.
     *
     * @return false if it exists but is not a writable directory, or cannot be created
     */
    public boolean ensureDirectory(Path path) {
        try {
            if (Files.exists(path)) {
                return Files.isDirectory(path) && Files.isWritable(path);
            }
            if (directoryPermissions != null && supportsPosix(path)) {
                Files.createDirectories(path,
                        PosixFilePermissions.asFileAttribute(directoryPermissions));
            } else {
                Files.createDirectories(path);
            }
            return Files.isWritable(path);
        } catch (IOException | SecurityException | UnsupportedOperationException e) {
            log.debug("Cache directory unavailable: {} ({})", path, e.toString());
            return false;
        }
    }

    /**
     * Location for the cache root. Null root means caching is not configured.
     */
    public CacheLocation root(Path root) {
        if (root == null) {
            return CacheLocation.disabled();
        }
        if (!ensureDirectory(root)) {
            log.debug("Caching disabled: {} is not a writable directory", root);
            return CacheLocation.disabled();
        }
        return CacheLocation.enabled(root);
    }

    /**
     * Location for a named subdirectory of {@code parent}; disabled if the parent is or if it cannot be created.
     */
    public CacheLocation subdirectory(CacheLocation parent, String name) {
        Optional<Path> dir = parent.directory();
        if (dir.isEmpty()) {
            return CacheLocation.disabled();
        }
        Path child = dir.get().resolve(name);
        if (!ensureDirectory(child)) {
            log.debug("Caching disabled for {}: not a writable directory", child);
            return CacheLocation.disabled();
        }
        return CacheLocation.enabled(child);
    }

    /**
     * Cache file for one request of an API.
     *
     * @param fieldValue value of the API's cache field; ignored when the API declares none
     * @return empty when the API has no usable cache directory
     */
    public Optional<Path> keyPath(Endpoint endpoint, Object fieldValue) {
        Optional<Path> dir = endpoint.getCacheLocation().directory();
        if (dir.isEmpty()) {
            return Optional.empty();
        }
        String identity = endpoint.hasCacheField() ? String.valueOf(fieldValue) : endpoint.getName();
        return Optional.of(dir.get().resolve(fileName(identity)));
    }

    /**
     * @return the cached table if the entry exists and is younger than {@code ttlSeconds}
     */
    public Optional<Table> readIfFresh(Path path, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return Optional.empty();
        }
        try {
            FileTime modified = Files.getLastModifiedTime(path);
            long ageMillis = clock.millis() - modified.toMillis();
            if (ageMillis >= ttlSeconds * 1000L) {
                log.debug("Cache entry stale: {} (age={}ms, ttl={}s)", path, ageMillis, ttlSeconds);
                return Optional.empty();
            }
            return Optional.of(codec.read(Files.readString(path, StandardCharsets.UTF_8)));

        } catch (NoSuchFileException e) {
            log.debug("Cache miss: {}", path);
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable cache entry {}, treating as miss", path, e);
            return Optional.empty();
        }
    }

    /**
     * Store a table, replacing any previous entry. Failures are logged and ignored.
     */
    public void write(Path path, Table table) {
        Path tmp = null;
        try {
            String csv = codec.write(table);
            tmp = Files.createTempFile(path.getParent(), ".tmp-", "." + TableCsvCodec.EXTENSION);
            Files.writeString(tmp, csv, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Cached {} rows at {}", table.rowCount(), path);

        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write cache entry {}", path, e);
            deleteQuietly(tmp);
        }
    }

    static String fileName(String identity) {
        return URLEncoder.encode(identity, StandardCharsets.UTF_8) + "." + TableCsvCodec.EXTENSION;
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not remove temporary cache file {}", tmp, e);
        }
    }

    private static boolean supportsPosix(Path path) {
        return path.getFileSystem().supportedFileAttributeViews().contains("posix");
    }
}
