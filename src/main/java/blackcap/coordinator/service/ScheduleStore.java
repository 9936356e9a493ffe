package blackcap.coordinator.service;

import blackcap.coordinator.error.ScheduleNotFoundException;
import blackcap.coordinator.error.ValidationException;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.model.User;
import blackcap.coordinator.repository.ScheduleRepository;
import blackcap.coordinator.schema.ItemResult;
import blackcap.coordinator.schema.ScheduleDelete;
import blackcap.coordinator.schema.ScheduleGetQueryParams;
import blackcap.coordinator.schema.ScheduleQueryType;
import blackcap.coordinator.schema.ScheduleUpdate;
import blackcap.coordinator.schema.ScheduledCreate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Schedule lifecycle over the repository. Batch operations isolate failures per item:
 * one bad item is reported in its {@link ItemResult} and never aborts the others.
 */
public class ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

    private final ScheduleRepository scheduleRepository;

    public ScheduleStore(ScheduleRepository scheduleRepository) {
        this.scheduleRepository = scheduleRepository;
    }

    /**
     * Persist one schedule per request, each in its own transaction.
     */
    public List<ItemResult<Schedule>> create(List<ScheduledCreate> requests, User user) {
        List<ItemResult<Schedule>> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ScheduledCreate request = requests.get(i);
            try {
                requireItem(request, i);
                results.add(ItemResult.success(i, scheduleRepository.create(request, user.userId())));
            } catch (RuntimeException e) {
                log.info("Schedule create #{} for job {} failed: {}", i,
                        request == null ? null : request.jobId(), e.getMessage());
                results.add(ItemResult.failure(i, e));
            }
        }
        return results;
    }

    /**
     * @return matching schedules, empty when nothing matches
     * @throws blackcap.coordinator.error.InvalidQueryException for an unknown query type or missing value
     */
    public List<Schedule> get(ScheduleGetQueryParams params) {
        ScheduleQueryType type = params.type();
        return scheduleRepository.findBy(type, params.value(), params.includeDeleted());
    }

    public List<ItemResult<Schedule>> update(List<ScheduleUpdate> updates) {
        List<ItemResult<Schedule>> results = new ArrayList<>(updates.size());
        for (int i = 0; i < updates.size(); i++) {
            ScheduleUpdate update = updates.get(i);
            try {
                requireItem(update, i).validate();
                results.add(ItemResult.success(i, scheduleRepository.update(update)));
            } catch (RuntimeException e) {
                log.info("Schedule update #{} failed: {}", i, e.getMessage());
                results.add(ItemResult.failure(i, e));
            }
        }
        return results;
    }

    /**
     * Soft-delete schedules. Missing or already deleted schedules are reported per item.
     *
     * @return per item, the id of the deleted schedule
     */
    public List<ItemResult<String>> delete(List<ScheduleDelete> deletes) {
        List<ItemResult<String>> results = new ArrayList<>(deletes.size());
        for (int i = 0; i < deletes.size(); i++) {
            ScheduleDelete delete = deletes.get(i);
            try {
                requireItem(delete, i).validate();
                if (!scheduleRepository.softDelete(delete.scheduleId())) {
                    throw new ScheduleNotFoundException("Schedule not found: " + delete.scheduleId());
                }
                results.add(ItemResult.success(i, delete.scheduleId()));
            } catch (RuntimeException e) {
                log.info("Schedule delete #{} failed: {}", i, e.getMessage());
                results.add(ItemResult.failure(i, e));
            }
        }
        return results;
    }

    /**
     * @throws ValidationException if a batch element is a JSON {@code null}
     */
    static <T> T requireItem(T item, int index) {
        if (item == null) {
            throw new ValidationException("item #" + index + " is null");
        }
        return item;
    }

    public int countActiveByCluster(String clusterId) {
        return scheduleRepository.countActiveByCluster(clusterId);
    }

    public List<Schedule> findActive() {
        return scheduleRepository.findActive();
    }
}
