package dev.rxcache.store;

import dev.rxcache.error.CacheFormatException;
import dev.rxcache.error.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Append-only cache of remote results kept in a flat text log, plus an in-memory index.
 *
 * <p>Log format, one record per three newline-terminated lines:
 * <pre>
 *   &lt;request key&gt;
 *   &lt;yyyyMMdd&gt;
 *   &lt;payload text&gt;
 * </pre>
 * A record is identified by the byte offset of its key line. The same key may occur more
 * than once; the later record wins in any index built from the log.
 *
 * <p>Exactly one holder per path opens the store in {@link AccessMode#APPEND}; every other
 * holder opens it {@link AccessMode#READ_ONLY} and works from the snapshot index it loaded at
 * startup. No file locks are taken. Readers stay consistent because records are
 * self-delimiting and the writer only ever appends at end-of-file.
 *
 * <p><strong>Thread Safety:</strong> an instance belongs to a single task and is not
 * thread-safe. Concurrent holders each open their own instance.
 */
public final class CacheStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CacheStore.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final int SCAN_BUFFER_BYTES = 64 * 1024;
    private static final int LOOKUP_BUFFER_BYTES = 8 * 1024;
    private static final int DEFAULT_PROGRESS_INTERVAL = 10_000;

    private final Path path;
    private final AccessMode mode;
    private final Clock clock;
    private final int progressInterval;
    private final RandomAccessFile file;
    private final CacheIndex index = new CacheIndex();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private boolean indexLoaded;

    private CacheStore(Path path, AccessMode mode, Clock clock, int progressInterval, RandomAccessFile file) {
        this.path = path;
        this.mode = mode;
        this.clock = clock;
        this.progressInterval = progressInterval;
        this.file = file;
    }

    public static CacheStore open(Path path, AccessMode mode) {
        return open(path, mode, Clock.systemDefaultZone(), DEFAULT_PROGRESS_INTERVAL);
    }

    /**
     * Opens the cache log.
     *
     * @param path             cache file location
     * @param mode             {@link AccessMode#APPEND} creates the file (and parent directories) when absent
     * @param clock            source of the date stamped on appended records
     * @param progressInterval records between progress lines while loading the index
     * @throws StoreUnavailableException if the file cannot be opened in the requested mode
     */
    public static CacheStore open(Path path, AccessMode mode, Clock clock, int progressInterval) {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        Objects.requireNonNull(clock, "clock cannot be null");
        try {
            File f = path.toFile();
            if (mode == AccessMode.APPEND) {
                File parent = f.getAbsoluteFile().getParentFile();
                if (parent != null && !parent.exists() && !parent.mkdirs()) {
                    throw new IOException("Failed to create directory: " + parent);
                }
            }
            RandomAccessFile raf = new RandomAccessFile(f, mode == AccessMode.APPEND ? "rw" : "r");
            logger.debug("Opened cache {} in {} mode ({} bytes)", path, mode, raf.length());
            return new CacheStore(path, mode, clock, Math.max(1, progressInterval), raf);
        } catch (IOException e) {
            logger.error("Failed to open cache {} in {} mode: {}", path, mode, e.getMessage());
            throw new StoreUnavailableException("Failed to open cache " + path + " in " + mode + " mode", e);
        }
    }

    /**
     * Scans the whole log from offset 0 and builds this holder's index. May be called once.
     * Afterwards the file cursor sits at end-of-file.
     *
     * @return the loaded index (also available through {@link #index()})
     * @throws CacheFormatException if the log ends inside a record or a date line is malformed
     */
    public CacheIndex loadIndex() {
        ensureOpen();
        if (indexLoaded) {
            throw new IllegalStateException("Index already loaded for cache " + path);
        }
        logger.info("Reading existing cache {}", path);
        long records = 0;
        long lineNumber = 0;
        try {
            LogLineReader reader = new LogLineReader(file, 0L, SCAN_BUFFER_BYTES);
            while (true) {
                long recordOffset = reader.position();
                String key = reader.readLine();
                if (key == null) {
                    break; // clean end: whole number of records
                }
                String date = reader.readLine();
                String payload = date == null ? null : reader.readLine();
                if (payload == null) {
                    int leftover = date == null ? 1 : 2;
                    throw new CacheFormatException(String.format(
                            "Cache file %s format error: %d trailing line(s) after record %d, not in groups of 3 lines",
                            path, leftover, records));
                }
                if (!reader.lastLineTerminated()) {
                    throw new CacheFormatException(String.format(
                            "Cache file %s format error: record %d at offset %d is not newline-terminated",
                            path, records + 1, recordOffset));
                }
                lineNumber += 3;
                if (date.length() != CacheRecord.DATE_LENGTH || !isAsciiDigits(date)) {
                    throw new CacheFormatException(String.format(
                            "Cache file %s format error: date not YYYYMMDD, line %d", path, lineNumber - 1));
                }
                index.put(key, new IndexEntry(recordOffset, date));
                records++;
                if (records % progressInterval == 0) {
                    logger.info("..Read {} entries from cache", records);
                }
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read cache " + path, e);
        }
        indexLoaded = true;
        logger.info("Done reading cache {}, found {} records ({} distinct keys)", path, records, index.size());
        return index;
    }

    /**
     * Reads the payload stored for {@code key}, if this holder's index knows it.
     */
    public Optional<String> lookup(String key) {
        ensureOpen();
        ensureIndexLoaded();
        Optional<IndexEntry> entry = index.get(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        long offset = entry.get().offset();
        try {
            LogLineReader reader = new LogLineReader(file, offset, LOOKUP_BUFFER_BYTES);
            String storedKey = reader.readLine();
            reader.readLine(); // date
            String payload = reader.readLine();
            if (!key.equals(storedKey) || payload == null) {
                throw new CacheFormatException(String.format(
                        "Cache file %s: index entry for [%s] at offset %d does not point at its record", path, key, offset));
            }
            return Optional.of(payload);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read cache " + path + " at offset " + offset, e);
        }
    }

    /**
     * Appends a record stamped with today's date from the store's clock.
     *
     * @see #append(String, String, LocalDate)
     */
    public long append(String key, String payload) {
        return append(key, payload, LocalDate.now(clock));
    }

    /**
     * Appends {@code key}, {@code today} and {@code payload} as one three-line record at
     * end-of-file and points this holder's index entry for {@code key} at it.
     *
     * <p>The record is written with a single write call so no holder ever indexes a partial record.
     *
     * @return byte offset at which the record begins
     * @throws IllegalStateException    if the store was not opened for append or the index is not loaded
     * @throws IllegalArgumentException if key or payload contains a line break
     */
    public long append(String key, String payload, LocalDate today) {
        ensureOpen();
        if (mode != AccessMode.APPEND) {
            throw new IllegalStateException("Cache " + path + " is open read-only");
        }
        ensureIndexLoaded();
        CacheRecord record = new CacheRecord(key, DATE_FORMAT.format(today), payload);
        byte[] bytes = (record.key() + '\n' + record.retrievalDate() + '\n' + record.payload() + '\n')
                .getBytes(StandardCharsets.UTF_8);
        try {
            long end = file.length();
            if (file.getFilePointer() != end) {
                file.seek(end); // a lookup moved the cursor
            }
            file.write(bytes);
            index.put(record.key(), new IndexEntry(end, record.retrievalDate()));
            return end;
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to append to cache " + path, e);
        }
    }

    public CacheIndex index() {
        return index;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            file.close();
            logger.debug("Closed cache {} ({} mode)", path, mode);
        } catch (IOException e) {
            logger.warn("Failed to close cache {}: {}", path, e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Cache " + path + " is closed");
        }
    }

    private void ensureIndexLoaded() {
        if (!indexLoaded) {
            throw new IllegalStateException("Index not loaded for cache " + path + "; call loadIndex() first");
        }
    }

    private static boolean isAsciiDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
