package in.vouchguard.repository;

import in.vouchguard.domain.activity.ActivityRecord;

import java.util.List;
import java.util.Optional;

public interface ActivityRepository {
    /**
     * Insert unless a record with the same activityId exists.
     *
     * @return true if a new row was written
     */
    boolean insertIfAbsent(ActivityRecord record);

    Optional<ActivityRecord> findByActivityId(String activityId);

    void markAlerted(String id);

    /**
     * @param negative   null for both
     * @param relationId null for all relationships
     */
    List<ActivityRecord> find(Boolean negative, String relationId, int limit, int offset);

    int count();

    int countNegative();
}
