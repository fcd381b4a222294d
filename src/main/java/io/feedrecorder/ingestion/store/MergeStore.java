package io.feedrecorder.ingestion.store;

import io.feedrecorder.ingestion.dto.FeedRecord;
import io.feedrecorder.ingestion.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Merges freshly fetched records into the output file. Records are deduplicated on their
 * non-empty entry URL, sorted newest first and the whole file is replaced in one move.
 */
@Service
public class MergeStore {

    private static final Logger logger = LoggerFactory.getLogger(MergeStore.class);

    // List.sort is stable, so equal timestamps keep existing-before-new order
    private static final Comparator<FeedRecord> NEWEST_FIRST =
            Comparator.comparing(FeedRecord::timestamp).reversed();

    private final Map<OutputFormat, RecordCodec> codecs = new EnumMap<>(OutputFormat.class);

    public MergeStore(List<RecordCodec> codecs) {
        codecs.forEach(codec -> this.codecs.put(codec.format(), codec));
    }

    /**
     * @return number of records in the output file after the merge
     * @throws io.feedrecorder.ingestion.exception.RecorderConfigException for an unsupported extension
     * @throws StoreException when the existing file is corrupt, locked or cannot be replaced
     */
    public int merge(Path outputPath, List<FeedRecord> newRecords) {
        OutputFormat format = OutputFormat.fromPath(outputPath);
        RecordCodec codec = codecs.get(format);
        if (codec == null) {
            throw new IllegalStateException("No codec registered for " + format);
        }

        try (StoreLock ignored = StoreLock.acquire(outputPath)) {
            List<FeedRecord> merged = Files.exists(outputPath)
                    ? mergeIntoExisting(codec, outputPath, newRecords)
                    : mergeIntoFresh(format, newRecords);

            merged.sort(NEWEST_FIRST);
            writeAtomically(codec, merged, outputPath);

            return merged.size();
        }
    }

    private List<FeedRecord> mergeIntoExisting(RecordCodec codec, Path outputPath, List<FeedRecord> newRecords) {
        List<FeedRecord> existing = readExisting(codec, outputPath);

        Set<String> knownUrls = new HashSet<>();
        for (FeedRecord record : existing) {
            if (record.hasEntryUrl()) {
                knownUrls.add(record.entryUrl());
            }
        }

        List<FeedRecord> accepted = filterNewRecords(newRecords, knownUrls);
        logger.info("Added {} new entries to existing {} entries", accepted.size(), existing.size());

        List<FeedRecord> merged = new ArrayList<>(existing.size() + accepted.size());
        merged.addAll(existing);
        merged.addAll(accepted);
        return merged;
    }

    private List<FeedRecord> mergeIntoFresh(OutputFormat format, List<FeedRecord> newRecords) {
        // a fresh file is held to the same unique entry URL rule
        List<FeedRecord> accepted = filterNewRecords(newRecords, new HashSet<>());
        logger.info("Created new {} file with {} entries", format, accepted.size());
        return new ArrayList<>(accepted);
    }

    /**
     * Keeps records without entry URL and the first record for every URL not yet known.
     * Accepted URLs are added to {@code knownUrls}.
     */
    private List<FeedRecord> filterNewRecords(List<FeedRecord> newRecords, Set<String> knownUrls) {
        List<FeedRecord> accepted = new ArrayList<>();
        int duplicates = 0;

        for (FeedRecord record : newRecords) {
            if (!record.hasEntryUrl() || knownUrls.add(record.entryUrl())) {
                accepted.add(record);
            } else {
                duplicates++;
            }
        }

        if (duplicates > 0) {
            logger.debug("Skipped {} entries with an already recorded entry URL", duplicates);
        }
        return accepted;
    }

    private List<FeedRecord> readExisting(RecordCodec codec, Path outputPath) {
        try {
            return codec.read(outputPath);
        } catch (IOException e) {
            throw StoreException.read(outputPath, e);
        }
    }

    private void writeAtomically(RecordCodec codec, List<FeedRecord> records, Path outputPath) {
        Path target = outputPath.toAbsolutePath();
        Path temp = target.resolveSibling("." + target.getFileName() + "." + UUID.randomUUID() + ".tmp");

        try {
            codec.write(records, temp);
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteTempFile(temp);
            throw StoreException.write(outputPath, e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTempFile(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    /**
     * Exclusive advisory lock on {@code <output>.lock}, held for one read-merge-write cycle.
     */
    private static final class StoreLock implements AutoCloseable {
        private final FileChannel channel;
        private final FileLock lock;

        private StoreLock(FileChannel channel, FileLock lock) {
            this.channel = channel;
            this.lock = lock;
        }

        static StoreLock acquire(Path outputPath) {
            Path lockPath = outputPath.toAbsolutePath().resolveSibling(outputPath.getFileName() + ".lock");
            FileChannel channel = null;

            try {
                Files.createDirectories(lockPath.getParent());
                channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);

                FileLock lock = channel.tryLock();
                if (lock == null) {
                    channel.close();
                    throw StoreException.locked(outputPath);
                }
                return new StoreLock(channel, lock);

            } catch (OverlappingFileLockException e) {
                closeQuietly(channel);
                throw StoreException.locked(outputPath);
            } catch (IOException e) {
                closeQuietly(channel);
                throw new StoreException(StoreException.Operation.LOCK, outputPath,
                        "Could not lock output file " + outputPath + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                lock.release();
                channel.close();
            } catch (IOException e) {
                logger.warn("Failed to release store lock: {}", e.getMessage());
            }
        }

        private static void closeQuietly(FileChannel channel) {
            if (channel == null) return;
            try {
                channel.close();
            } catch (IOException e) {
                logger.warn("Failed to close lock file channel: {}", e.getMessage());
            }
        }
    }
}
