package rawt.dal;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.common.EContentType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable queue of jobs that could not be printed yet.
 *
 * <p>Records live in {@code pending-jobs.json} keyed by job id, content copies in the
 * {@code pending/} directory next to it. Content is written before the record, and a record
 * is only removed together with its content. Records are returned in creation order.</p>
 *
 * @since 19/10/2026
 */
public class PendingJobStore {
    private static final Logger logger = LoggerFactory.getLogger(PendingJobStore.class);

    private final Path recordsFile;
    private final Path contentDirectory;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final Map<String, PendingJob> records = new LinkedHashMap<>();
    private long nextSequence;

    public PendingJobStore(StoreConfig storeConfig) throws StoreException {
        this.recordsFile = storeConfig.pendingJobsFile();
        this.contentDirectory = storeConfig.pendingContentDirectory();

        List<PendingJob> loaded = JsonFiles.read(gson, recordsFile, new TypeToken<List<PendingJob>>() {}.getType());
        if (loaded != null) {
            loaded.sort(Comparator.comparingLong(PendingJob::sequence));
            for (PendingJob job : loaded) {
                if (Files.isRegularFile(contentDirectory.resolve(job.contentFile()))) {
                    records.put(job.id(), job);
                    nextSequence = Math.max(nextSequence, job.sequence() + 1);
                } else {
                    logger.warn("Dropping pending job {}: content file {} is missing", job.id(), job.contentFile());
                }
            }
        }
        logger.info("✓ Pending job store ready: {} job(s) waiting", records.size());
    }

    /**
     * Copy the content into the store and record the job
     * @param content stream with the job content, consumed but not closed
     */
    public synchronized PendingJob add(String jobId, String title, EContentType contentType,
                                       String mimeType, InputStream content) throws StoreException {
        if (records.containsKey(jobId)) {
            throw new IllegalArgumentException("Pending job already exists: " + jobId);
        }

        String contentFile = jobId + extensionFor(contentType, mimeType);
        Path target = contentDirectory.resolve(contentFile);
        try {
            Files.createDirectories(contentDirectory);
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(target);
            throw new StoreException("Cannot store content of job " + jobId + ": " + e.getMessage(), e);
        }

        PendingJob job = new PendingJob(jobId, title, contentType, mimeType, contentFile,
                System.currentTimeMillis(), nextSequence);
        Map<String, PendingJob> updated = new LinkedHashMap<>(records);
        updated.put(jobId, job);
        try {
            persist(updated);
        } catch (StoreException e) {
            deleteQuietly(target);
            throw e;
        }

        records.put(jobId, job);
        nextSequence++;
        logger.info("Pending job stored: {}", job);
        return job;
    }

    public synchronized Optional<PendingJob> get(String jobId) {
        return Optional.ofNullable(records.get(jobId));
    }

    /**
     * All waiting jobs, oldest first
     */
    public synchronized List<PendingJob> list() {
        return new ArrayList<>(records.values());
    }

    public synchronized int size() {
        return records.size();
    }

    /**
     * Path of the stored content copy
     */
    public Path contentPath(PendingJob job) {
        return contentDirectory.resolve(job.contentFile());
    }

    public byte[] readContent(PendingJob job) throws StoreException {
        try {
            return Files.readAllBytes(contentPath(job));
        } catch (IOException e) {
            throw new StoreException("Cannot read content of job " + job.id() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Remove the record and its content copy
     */
    public synchronized boolean remove(String jobId) throws StoreException {
        PendingJob job = records.get(jobId);
        if (job == null) {
            return false;
        }
        Map<String, PendingJob> updated = new LinkedHashMap<>(records);
        updated.remove(jobId);
        persist(updated);
        records.remove(jobId);

        try {
            Files.deleteIfExists(contentPath(job));
        } catch (IOException e) {
            logger.warn("Pending job {} removed but its content could not be deleted: {}", jobId, e.getMessage());
        }
        logger.info("Pending job removed: {}", jobId);
        return true;
    }

    private void persist(Map<String, PendingJob> snapshot) throws StoreException {
        JsonFiles.writeAtomically(gson, recordsFile, new ArrayList<>(snapshot.values()));
    }

    private static String extensionFor(EContentType contentType, String mimeType) {
        switch (contentType) {
            case TEXT:
                return ".json";
            case RAW:
                return ".bin";
            default:
                if (mimeType == null) {
                    return ".dat";
                }
                if (mimeType.startsWith("application/pdf")) {
                    return ".pdf";
                }
                if (mimeType.startsWith("image/png")) {
                    return ".png";
                }
                if (mimeType.startsWith("image/jpeg")) {
                    return ".jpg";
                }
                return ".dat";
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
