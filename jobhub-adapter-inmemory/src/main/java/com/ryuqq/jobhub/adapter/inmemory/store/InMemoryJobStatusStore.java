package com.ryuqq.jobhub.adapter.inmemory.store;

import com.ryuqq.jobhub.core.job.JobRecord;
import com.ryuqq.jobhub.core.model.JobId;
import com.ryuqq.jobhub.core.model.UserId;
import com.ryuqq.jobhub.core.spi.JobStatusStore;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link JobStatusStore}.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>records:</strong> ConcurrentHashMap&lt;JobId, JobRecord&gt; - latest record per job (O(1) upsert)</li>
 * </ul>
 *
 * <p>{@link #findByUser(UserId)} scans all records, which is fine for the
 * volumes a single hub process keeps in memory.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Finished jobs stay until {@link #evictTerminalBefore(Instant)} removes them;
 *       the owner must call it periodically to bound memory</li>
 * </ul>
 *
 * @author JobHub Team
 * @since 1.0.0
 */
public class InMemoryJobStatusStore implements JobStatusStore {

    private final ConcurrentHashMap<JobId, JobRecord> records = new ConcurrentHashMap<>();

    @Override
    public void save(JobRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        records.put(record.jobId(), record);
    }

    @Override
    public Optional<JobRecord> find(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        return Optional.ofNullable(records.get(jobId));
    }

    @Override
    public List<JobRecord> findByUser(UserId userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        return records.values().stream()
            .filter(record -> record.userId().equals(userId))
            .sorted(Comparator.comparing(JobRecord::updatedAt))
            .collect(Collectors.toList());
    }

    @Override
    public int evictTerminalBefore(Instant cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("cutoff cannot be null");
        }
        int evicted = 0;
        for (JobRecord record : records.values()) {
            // remove(key, value) keeps a record that was updated concurrently
            if (record.status().isTerminal()
                && record.updatedAt().isBefore(cutoff)
                && records.remove(record.jobId(), record)) {
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * Number of stored jobs.
     *
     * @return record count
     */
    public int size() {
        return records.size();
    }

    /**
     * Removes every record.
     */
    public void clear() {
        records.clear();
    }
}
