package blackcap.coordinator.service;

import blackcap.coordinator.auth.AccessGuard;
import blackcap.coordinator.auth.Action;
import blackcap.coordinator.auth.SessionToken;
import blackcap.coordinator.model.Schedule;
import blackcap.coordinator.model.User;
import blackcap.coordinator.scheduler.Scheduler;
import blackcap.coordinator.schema.ItemResult;
import blackcap.coordinator.schema.ScheduleCreate;
import blackcap.coordinator.schema.ScheduleDelete;
import blackcap.coordinator.schema.ScheduleGetQueryParams;
import blackcap.coordinator.schema.ScheduleUpdate;
import blackcap.coordinator.schema.ScheduledCreate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Authorized entry point for schedule operations.
 * Authorization happens once per call, before any item is touched.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final AccessGuard accessGuard;
    private final Scheduler scheduler;
    private final ScheduleStore store;

    public ScheduleService(AccessGuard accessGuard, Scheduler scheduler, ScheduleStore store) {
        this.accessGuard = accessGuard;
        this.scheduler = scheduler;
        this.store = store;
    }

    /**
     * Choose a cluster for each request and persist the resulting schedules.
     * Scheduling failures and store failures are both reported at the request's index.
     */
    public List<ItemResult<Schedule>> create(SessionToken token, List<ScheduleCreate> requests) {
        User user = accessGuard.require(token, Action.CREATE_SCHEDULE);

        List<ItemResult<Schedule>> merged = new ArrayList<>(Collections.nCopies(requests.size(), null));
        List<ScheduledCreate> placed = new ArrayList<>();
        List<Integer> placedIndex = new ArrayList<>();

        for (int i = 0; i < requests.size(); i++) {
            try {
                placed.add(scheduler.schedule(ScheduleStore.requireItem(requests.get(i), i)));
                placedIndex.add(i);
            } catch (RuntimeException e) {
                log.info("Scheduling request #{} failed: {}", i, e.getMessage());
                merged.set(i, ItemResult.failure(i, e));
            }
        }

        List<ItemResult<Schedule>> stored = store.create(placed, user);
        for (ItemResult<Schedule> result : stored) {
            int original = placedIndex.get(result.index());
            merged.set(original, result.atIndex(original));
        }

        log.info("{} requested {} schedules, {} created", user.email(), requests.size(),
                stored.stream().filter(ItemResult::isSuccess).count());
        return merged;
    }

    public List<Schedule> get(SessionToken token, ScheduleGetQueryParams params) {
        accessGuard.require(token, Action.READ);
        return store.get(params);
    }

    public List<ItemResult<Schedule>> update(SessionToken token, List<ScheduleUpdate> updates) {
        accessGuard.require(token, Action.UPDATE_SCHEDULE);
        return store.update(updates);
    }

    public List<ItemResult<String>> delete(SessionToken token, List<ScheduleDelete> deletes) {
        accessGuard.require(token, Action.DELETE_SCHEDULE);
        return store.delete(deletes);
    }
}
