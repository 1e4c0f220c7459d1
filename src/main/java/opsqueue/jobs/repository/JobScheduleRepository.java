package opsqueue.jobs.repository;

import opsqueue.jobs.model.JobSchedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for recurring job definitions.
 */
public interface JobScheduleRepository {

    /**
     * @throws opsqueue.jobs.store.DuplicateScheduleKeyException if the key is taken
     */
    void insert(JobSchedule schedule);

    /**
     * Overwrite the editable columns of a schedule.
     *
     * @return false if the schedule does not exist
     */
    boolean update(JobSchedule schedule);

    Optional<JobSchedule> findById(String id);

    Optional<JobSchedule> findByKey(String key);

    List<JobSchedule> findAll();

    /**
     * Enabled schedules with next_run_at at or before now, earliest first.
     */
    List<JobSchedule> findDue(Instant now, int limit);

    /**
     * Advance a schedule's clock, but only if next_run_at still holds the value
     * the caller read.
     */
    boolean advance(String id, Instant expectedNextRunAt, Instant nextRunAt, Instant lastEnqueuedAt,
            String lastRunJobId);

    int countDue(Instant now);
}
