package com.github.dimitryivaniuta.canvas.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.canvas.exception.CanvasApiException;
import com.github.dimitryivaniuta.canvas.support.DigestSupport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Cache entries as gzipped JSON files, one per key, under {@code <dir>/ab/cd/abcd....cache}
 * (md5 of the key). The key is stored inside the file so pattern deletes can match on it.
 *
 * <p>Writes go to a temp file first and are moved into place, so readers never see a partial
 * entry. Unreadable files are deleted and reported as misses.
 */
@Slf4j
public class FileSystemCacheAdapter implements CacheAdapter {

    private static final String EXTENSION = ".cache";

    /** On-disk layout. {@code expiresAt} is epoch seconds, 0 for no expiry. */
    record FileEntry(String key, CachedResponse value, long expiresAt, long createdAt) {}

    private final Path cacheDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public FileSystemCacheAdapter(Path cacheDir, ObjectMapper objectMapper) {
        this(cacheDir, objectMapper, Clock.systemUTC());
    }

    public FileSystemCacheAdapter(Path cacheDir, ObjectMapper objectMapper, Clock clock) {
        this.cacheDir = cacheDir;
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(cacheDir);
        } catch (IOException e) {
            throw new CanvasApiException("Failed to create cache directory: " + cacheDir, e);
        }
        if (!Files.isWritable(cacheDir)) {
            throw new CanvasApiException("Cache directory is not writable: " + cacheDir);
        }
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        Optional<FileEntry> entry = read(pathFor(key));
        if (entry.isEmpty()) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.ofNullable(entry.get().value());
    }

    @Override
    public void set(String key, CachedResponse value, long ttlSeconds) {
        long now = clock.instant().getEpochSecond();
        FileEntry entry = new FileEntry(key, value, ttlSeconds > 0 ? now + ttlSeconds : 0, now);

        Path target = pathFor(key);
        Path temp = target.resolveSibling(target.getFileName() + ".tmp." + UUID.randomUUID());
        try {
            Files.createDirectories(target.getParent());
            try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(temp))) {
                objectMapper.writeValue(out, entry);
            }
            move(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CanvasApiException("Failed to write cache file: " + target, e);
        }
    }

    @Override
    public boolean delete(String key) {
        return deleteQuietly(pathFor(key));
    }

    @Override
    public boolean has(String key) {
        return read(pathFor(key)).isPresent();
    }

    @Override
    public void clear() {
        try (Stream<Path> paths = Files.walk(cacheDir)) {
            paths.sorted(Comparator.reverseOrder())
                    .filter(p -> !p.equals(cacheDir))
                    .forEach(FileSystemCacheAdapter::deleteQuietly);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear cache directory: " + cacheDir, e);
        }
        hits.set(0);
        misses.set(0);
    }

    @Override
    public int deleteByPattern(String pattern) {
        Pattern regex = GlobPatterns.toRegex(pattern);
        int deleted = 0;
        for (Path file : cacheFiles()) {
            Optional<FileEntry> entry = read(file);
            if (entry.isPresent() && regex.matcher(entry.get().key()).matches() && deleteQuietly(file)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public CacheStats getStats() {
        long size = 0;
        long entries = 0;
        for (Path file : cacheFiles()) {
            try {
                size += Files.size(file);
                entries++;
            } catch (IOException e) {
                log.debug("Cache file vanished while collecting stats: {}", file);
            }
        }
        return new CacheStats(hits.get(), misses.get(), size, entries);
    }

    /**
     * Deletes expired and unreadable entries.
     *
     * @return number of files removed
     */
    public int cleanExpired() {
        int removed = 0;
        for (Path file : cacheFiles()) {
            // read() drops expired and corrupt files itself
            if (read(file).isEmpty() && !Files.exists(file)) {
                removed++;
            }
        }
        return removed;
    }

    Path pathFor(String key) {
        String hash = DigestSupport.md5Hex(key);
        return cacheDir.resolve(hash.substring(0, 2)).resolve(hash.substring(2, 4)).resolve(hash + EXTENSION);
    }

    private Optional<FileEntry> read(Path file) {
        if (!Files.exists(file)) return Optional.empty();

        FileEntry entry;
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            entry = objectMapper.readValue(in, FileEntry.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Dropping unreadable cache file {}: {}", file, e.getMessage());
            deleteQuietly(file);
            return Optional.empty();
        }

        if (entry == null || entry.key() == null) {
            deleteQuietly(file);
            return Optional.empty();
        }
        if (entry.expiresAt() > 0 && entry.expiresAt() <= clock.instant().getEpochSecond()) {
            deleteQuietly(file);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private List<Path> cacheFiles() {
        if (!Files.isDirectory(cacheDir)) return List.of();
        try (Stream<Path> paths = Files.walk(cacheDir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list cache directory: " + cacheDir, e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete cache file {}: {}", file, e.getMessage());
            return false;
        }
    }
}
