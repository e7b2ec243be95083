/**
 * Sharded JSON file cache for lookup outcomes
 *
 * @author William Callahan
 *
 * Features:
 * - One JSON file per lookup key under a two-character hash shard
 * - Atomic writes (temp file in the shard, then rename over the target)
 * - Per-entry read/write locks from a weak-valued Caffeine registry
 * - Separate TTLs for found and not_found records, expired entries removed on read
 * - LRU eviction by file modification time once entry or size limits are hit
 * - Access index rebuilt from modification times on startup
 */
package com.williamcallahan.cinema_lookup.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.williamcallahan.cinema_lookup.config.AppConfigurationProperties;
import com.williamcallahan.cinema_lookup.exception.CorruptStateException;
import com.williamcallahan.cinema_lookup.model.CacheRecord;
import com.williamcallahan.cinema_lookup.model.CacheStatus;
import com.williamcallahan.cinema_lookup.util.LookupKeys;
import com.williamcallahan.cinema_lookup.util.TextUtils;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Stream;

@Service
public class DiskCacheService {

    private static final Logger logger = LoggerFactory.getLogger(DiskCacheService.class);

    private static final String ENTRY_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final int SHARD_LENGTH = 2;
    private static final int HASH_LENGTH = 12;
    private static final int MAX_NAME_LENGTH = 80;
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final Path root;
    private final ObjectMapper objectMapper;
    private final CacheTtlPolicy ttlPolicy;
    private final Clock clock;
    private final int maxEntries;
    private final long maxSizeBytes;
    private final double evictionFraction;

    private final Cache<String, ReentrantReadWriteLock> entryLocks = Caffeine.newBuilder().weakValues().build();
    private final Map<Path, IndexEntry> index = new ConcurrentHashMap<>();
    private final ReentrantLock maintenanceLock = new ReentrantLock();

    private record IndexEntry(long lastAccessMillis, long sizeBytes) {
    }

    private enum ReadOutcome {
        HIT,
        INVALID,
        EXPIRED
    }

    @Autowired
    public DiskCacheService(AppConfigurationProperties properties, ObjectMapper objectMapper,
                            CacheTtlPolicy ttlPolicy, Clock clock) {
        this(Paths.get(properties.getCache().getDir()), objectMapper, ttlPolicy, clock,
            properties.getCache().getMaxEntries(),
            properties.getCache().getMaxSizeMb() * 1024L * 1024L,
            properties.getCache().getEvictionFraction());
    }

    public DiskCacheService(Path root, ObjectMapper objectMapper, CacheTtlPolicy ttlPolicy, Clock clock,
                            int maxEntries, long maxSizeBytes, double evictionFraction) {
        this.root = root;
        this.objectMapper = objectMapper;
        this.ttlPolicy = ttlPolicy;
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.maxSizeBytes = maxSizeBytes;
        this.evictionFraction = evictionFraction;
    }

    /**
     * Creates the cache directory and rebuilds the access index from file modification times
     */
    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            logger.error("Could not create cache directory {}: {}", root, e.getMessage(), e);
            return;
        }
        index.clear();
        try (Stream<Path> files = Files.walk(root, 2)) {
            files.filter(this::isShardEntry).forEach(file -> {
                try {
                    index.put(file, new IndexEntry(Files.getLastModifiedTime(file).toMillis(), Files.size(file)));
                } catch (IOException e) {
                    logger.warn("Skipping unreadable cache entry {}: {}", file, e.getMessage());
                }
            });
        } catch (IOException e) {
            logger.error("Could not index cache directory {}: {}", root, e.getMessage(), e);
        }
        logger.info("Disk cache at {} holds {} entries ({} bytes)", root, index.size(), totalSizeBytes());
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Reads a record, removing it when it is corrupt or past its TTL
     *
     * @param key lookup key
     * @return the stored record on a hit
     * @throws IllegalArgumentException for a malformed key
     */
    public Optional<CacheRecord> read(String key) {
        Path file = pathFor(requireValidKey(key));
        ReentrantReadWriteLock lock = lockFor(file);
        Instant now = clock.instant();

        CacheRecord record = null;
        ReadOutcome outcome;
        lock.readLock().lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            try {
                record = parse(file);
                if (!key.equals(record.lookupKey())) {
                    outcome = ReadOutcome.INVALID;
                } else if (ttlPolicy.isExpired(record, now)) {
                    outcome = ReadOutcome.EXPIRED;
                } else {
                    outcome = ReadOutcome.HIT;
                    touch(file, now);
                }
            } catch (CorruptStateException e) {
                logger.warn("Discarding corrupt cache entry {}: {}", e.getPath(), e.getMessage());
                outcome = ReadOutcome.INVALID;
            }
        } finally {
            lock.readLock().unlock();
        }

        if (outcome == ReadOutcome.HIT) {
            return Optional.of(record);
        }
        if (outcome == ReadOutcome.EXPIRED) {
            logger.debug("Cache entry {} expired (fetched {})", key, record.fetchedAt());
        }
        removeIfStale(file, key, now);
        return Optional.empty();
    }

    /**
     * Stores a record atomically, evicting least recently used entries first when the cache is full
     *
     * @return true when the record is on disk
     * @throws IllegalArgumentException for a malformed key
     */
    public boolean write(String key, CacheRecord record) {
        Path file = pathFor(requireValidKey(key));
        if (record == null || !record.isStructurallyValid() || !key.equals(record.lookupKey())) {
            logger.warn("Refusing to cache structurally invalid record for {}", key);
            return false;
        }

        byte[] bytes;
        try {
            bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(record);
        } catch (IOException e) {
            logger.error("Could not serialize cache record for {}: {}", key, e.getMessage(), e);
            return false;
        }

        if (!index.containsKey(file) && atCapacity(bytes.length)) {
            evict(bytes.length);
        }

        ReentrantReadWriteLock lock = lockFor(file);
        lock.writeLock().lock();
        Path tempFile = null;
        try {
            Files.createDirectories(file.getParent());
            tempFile = Files.createTempFile(file.getParent(), file.getFileName().toString(), TEMP_SUFFIX);
            Files.write(tempFile, bytes);
            moveIntoPlace(tempFile, file);
            Instant now = clock.instant();
            touch(file, now);
            index.put(file, new IndexEntry(now.toEpochMilli(), bytes.length));
            return true;
        } catch (IOException e) {
            logger.error("Failed to write cache entry {}: {}", file, e.getMessage(), e);
            deleteQuietly(tempFile);
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return true when an entry was removed
     * @throws IllegalArgumentException for a malformed key
     */
    public boolean delete(String key) {
        Path file = pathFor(requireValidKey(key));
        ReentrantReadWriteLock lock = lockFor(file);
        lock.writeLock().lock();
        try {
            index.remove(file);
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.error("Failed to delete cache entry {}: {}", file, e.getMessage(), e);
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every cache entry and root-level JSON file the predicate does not preserve
     *
     * @param preserve files to keep, e.g. the credential file
     * @return number of files removed
     */
    public int clear(Predicate<Path> preserve) {
        int removed = 0;
        List<Path> candidates = new ArrayList<>();
        try (Stream<Path> files = Files.walk(root, 2)) {
            files.filter(Files::isRegularFile)
                .filter(file -> file.getFileName().toString().endsWith(ENTRY_SUFFIX)
                    || file.getFileName().toString().endsWith(TEMP_SUFFIX))
                .forEach(candidates::add);
        } catch (IOException e) {
            logger.error("Could not list cache directory {}: {}", root, e.getMessage(), e);
            return 0;
        }

        for (Path file : candidates) {
            if (preserve != null && preserve.test(file)) {
                logger.debug("Preserving {}", file);
                continue;
            }
            ReentrantReadWriteLock lock = lockFor(file);
            lock.writeLock().lock();
            try {
                index.remove(file);
                if (Files.deleteIfExists(file) && file.getFileName().toString().endsWith(ENTRY_SUFFIX)) {
                    removed++;
                }
            } catch (IOException e) {
                logger.warn("Could not remove {}: {}", file, e.getMessage());
            } finally {
                lock.writeLock().unlock();
            }
        }
        removeEmptyShards();
        logger.info("Cleared {} cache files from {}", removed, root);
        return removed;
    }

    /**
     * @return lookup keys of all readable entries, expired ones included
     */
    public List<String> keys() {
        List<String> keys = new ArrayList<>();
        for (Path file : List.copyOf(index.keySet())) {
            readForMaintenance(file).ifPresent(record -> keys.add(record.lookupKey()));
        }
        keys.sort(Comparator.naturalOrder());
        return keys;
    }

    public CacheStats stats() {
        Instant now = clock.instant();
        int found = 0;
        int notFound = 0;
        int expired = 0;
        for (Path file : List.copyOf(index.keySet())) {
            Optional<CacheRecord> record = readForMaintenance(file);
            if (record.isEmpty()) {
                continue;
            }
            if (record.get().status() == CacheStatus.FOUND) {
                found++;
            } else {
                notFound++;
            }
            if (ttlPolicy.isExpired(record.get(), now)) {
                expired++;
            }
        }
        return new CacheStats(index.size(), found, notFound, expired, totalSizeBytes(), maxEntries, maxSizeBytes);
    }

    Path pathFor(String key) {
        String hash = TextUtils.sha256Hex(key);
        String name = UNSAFE_NAME_CHARS.matcher(key).replaceAll("_");
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }
        return root.resolve(hash.substring(0, SHARD_LENGTH))
            .resolve(name + "_" + hash.substring(0, HASH_LENGTH) + ENTRY_SUFFIX);
    }

    private static String requireValidKey(String key) {
        if (!LookupKeys.isValid(key)) {
            throw new IllegalArgumentException("Invalid cache key: " + key);
        }
        return key;
    }

    private ReentrantReadWriteLock lockFor(Path file) {
        return entryLocks.get(file.toAbsolutePath().toString(), ignored -> new ReentrantReadWriteLock());
    }

    private CacheRecord parse(Path file) {
        CacheRecord record;
        try {
            record = objectMapper.readValue(file.toFile(), CacheRecord.class);
        } catch (IOException e) {
            throw new CorruptStateException(file, "unparseable JSON", e);
        }
        if (record == null || !record.isStructurallyValid()) {
            throw new CorruptStateException(file, "record violates status/description invariants", null);
        }
        return record;
    }

    private Optional<CacheRecord> readForMaintenance(Path file) {
        ReentrantReadWriteLock lock = lockFor(file);
        lock.readLock().lock();
        try {
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            return Optional.of(parse(file));
        } catch (CorruptStateException e) {
            logger.debug("Skipping corrupt entry {}: {}", e.getPath(), e.getMessage());
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Re-validated under the write lock: a concurrent write may have replaced the entry
    private void removeIfStale(Path file, String key, Instant now) {
        ReentrantReadWriteLock lock = lockFor(file);
        lock.writeLock().lock();
        try {
            if (!Files.exists(file)) {
                index.remove(file);
                return;
            }
            boolean stale;
            try {
                CacheRecord current = parse(file);
                stale = !key.equals(current.lookupKey()) || ttlPolicy.isExpired(current, now);
            } catch (CorruptStateException e) {
                stale = true;
            }
            if (stale) {
                Files.deleteIfExists(file);
                index.remove(file);
            }
        } catch (IOException e) {
            logger.warn("Could not remove stale cache entry {}: {}", file, e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean atCapacity(long incomingBytes) {
        return index.size() >= maxEntries || totalSizeBytes() + incomingBytes > maxSizeBytes;
    }

    private void evict(long incomingBytes) {
        if (!maintenanceLock.tryLock()) {
            logger.debug("Eviction already running on another thread");
            return;
        }
        try {
            if (!atCapacity(incomingBytes)) {
                return;
            }
            int target = Math.max(1, (int) (index.size() * evictionFraction));
            List<Map.Entry<Path, IndexEntry>> oldest = index.entrySet().stream()
                .sorted(Comparator.comparingLong(entry -> entry.getValue().lastAccessMillis()))
                .limit(target)
                .toList();
            int evicted = 0;
            for (Map.Entry<Path, IndexEntry> entry : oldest) {
                Path file = entry.getKey();
                ReentrantReadWriteLock lock = lockFor(file);
                lock.writeLock().lock();
                try {
                    index.remove(file);
                    if (Files.deleteIfExists(file)) {
                        evicted++;
                    }
                } catch (IOException e) {
                    logger.warn("Could not evict {}: {}", file, e.getMessage());
                } finally {
                    lock.writeLock().unlock();
                }
            }
            logger.info("Evicted {} least recently used cache entries ({} remain)", evicted, index.size());
        } finally {
            maintenanceLock.unlock();
        }
    }

    private void touch(Path file, Instant now) {
        try {
            Files.setLastModifiedTime(file, FileTime.from(now));
        } catch (IOException e) {
            logger.debug("Could not update access time of {}: {}", file, e.getMessage());
        }
        index.computeIfPresent(file, (path, entry) -> new IndexEntry(now.toEpochMilli(), entry.sizeBytes()));
    }

    private long totalSizeBytes() {
        return index.values().stream().mapToLong(IndexEntry::sizeBytes).sum();
    }

    private boolean isShardEntry(Path file) {
        Path parent = file.getParent();
        return Files.isRegularFile(file)
            && file.getFileName().toString().endsWith(ENTRY_SUFFIX)
            && parent != null
            && !parent.equals(root)
            && parent.getFileName().toString().length() == SHARD_LENGTH;
    }

    private void removeEmptyShards() {
        try (DirectoryStream<Path> shards = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path shard : shards) {
                try (Stream<Path> contents = Files.list(shard)) {
                    if (contents.findAny().isEmpty()) {
                        Files.deleteIfExists(shard);
                    }
                }
            }
        } catch (IOException e) {
            logger.debug("Could not prune empty shards under {}: {}", root, e.getMessage());
        }
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not remove temp file {}: {}", path, e.getMessage());
        }
    }
}
