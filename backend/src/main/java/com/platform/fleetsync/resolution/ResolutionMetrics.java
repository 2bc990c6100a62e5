package com.platform.fleetsync.resolution;

public record ResolutionMetrics(
    long pendingRequests,
    long approvedRequests,
    long rejectedRequests,
    long openTrends,
    long resolvedTrends,
    long runsCompleted,
    long runsFailed
) {
}
