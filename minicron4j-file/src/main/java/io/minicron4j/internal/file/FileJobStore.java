package io.minicron4j.internal.file;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.minicron4j.core.Job;
import io.minicron4j.core.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * JSON file persistence for jobs.
 *
 * <p>Semantics:
 * <ul>
 *   <li>load: a missing or unreadable file is treated as "no jobs"</li>
 *   <li>save: the whole document is written to a temp file and moved over the target</li>
 *   <li>no locking: only one process may use a file at a time</li>
 * </ul>
 */
public class FileJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(FileJobStore.class);

    public static final int SCHEMA_VERSION = 1;

    private final Path jobsPath;
    private final ObjectMapper objectMapper;

    public FileJobStore(Path jobsPath, ObjectMapper objectMapper) {
        this.jobsPath = Objects.requireNonNull(jobsPath, "jobsPath must not be null").toAbsolutePath();
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getJobsPath() {
        return jobsPath;
    }

    /**
     * Create the directory holding the jobs file.
     */
    public void ensureDirectory() {
        try {
            Files.createDirectories(jobsPath.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create jobs directory " + jobsPath.getParent(), e);
        }
    }

    @Override
    public List<Job> load() {
        if (!Files.exists(jobsPath)) {
            log.debug("Jobs file not found, starting empty path={}", jobsPath);
            return new ArrayList<>();
        }

        JobStoreDocument doc;
        try {
            doc = objectMapper.readValue(jobsPath.toFile(), JobStoreDocument.class);
        } catch (IOException | RuntimeException e) {
            log.warn("Jobs file unreadable, starting empty path={} msg={}", jobsPath, e.getMessage());
            return new ArrayList<>();
        }

        if (doc == null || doc.getJobs() == null) {
            return new ArrayList<>();
        }
        if (doc.getVersion() != SCHEMA_VERSION) {
            log.warn("Jobs file has unexpected version path={} version={} expected={}",
                    jobsPath, doc.getVersion(), SCHEMA_VERSION);
        }

        List<Job> jobs = new ArrayList<>(doc.getJobs().size());
        Set<String> seen = new HashSet<>();
        for (JobDocument d : doc.getJobs()) {
            if (d == null || d.getId() == null) {
                log.warn("Skipping job without id path={}", jobsPath);
                continue;
            }
            if (!seen.add(d.getId())) {
                log.warn("Skipping duplicate job id={} path={}", d.getId(), jobsPath);
                continue;
            }
            jobs.add(d.toJob());
        }
        log.debug("Jobs loaded count={} path={}", jobs.size(), jobsPath);
        return jobs;
    }

    @Override
    public boolean save(List<Job> jobs) {
        Objects.requireNonNull(jobs, "jobs must not be null");

        List<JobDocument> docs = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            docs.add(JobDocument.fromJob(job));
        }
        JobStoreDocument doc = new JobStoreDocument(docs, SCHEMA_VERSION);

        Path tmp = null;
        try {
            Files.createDirectories(jobsPath.getParent());
            tmp = Files.createTempFile(jobsPath.getParent(), jobsPath.getFileName().toString(), ".tmp");
            objectMapper.writeValue(tmp.toFile(), doc);
            moveIntoPlace(tmp);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Jobs save failed path={} msg={}", jobsPath, e.getMessage(), e);
            deleteQuietly(tmp);
            return false;
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, jobsPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, jobsPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not delete temp file path={} msg={}", tmp, e.getMessage());
        }
    }
}
