package in.vouchguard.repository;

import in.vouchguard.domain.monitoring.CycleLog;

import java.util.List;

public interface CycleLogRepository {
    void insert(CycleLog cycleLog);

    /**
     * Most recent first.
     */
    List<CycleLog> findRecent(int limit);
}
