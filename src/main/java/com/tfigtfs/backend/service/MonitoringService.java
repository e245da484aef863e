package com.tfigtfs.backend.service;

public interface MonitoringService {

    MonitoringService NONE = new MonitoringService() {
        @Override
        public void recordPollingDuration(String resource, long durationMs, String status) {
        }

        @Override
        public void recordSnapshotSize(String resource, int count) {
        }
    };

    /**
     * Records the duration and status of a fetch cycle.
     *
     * @param resource   The agent name (e.g., "static assets", "realtime data")
     * @param durationMs The duration of the operation in milliseconds
     * @param status     The status of the operation (e.g., "SUCCESS", "FAILED", "SKIPPED")
     */
    void recordPollingDuration(String resource, long durationMs, String status);

    /**
     * Records the number of rows held by the latest snapshot of a resource.
     *
     * @param resource The snapshot name
     * @param count    The number of rows
     */
    void recordSnapshotSize(String resource, int count);
}
