package com.schedq;

public record SchedulerStats(
        boolean running,
        int totalJobs,
        int activeJobs,
        int pausedJobs,
        long totalRuns,
        long successRuns,
        long failedRuns,
        int runningInstances) {

    public double successRate() {
        return rate(successRuns, totalRuns);
    }

    static double rate(long successRuns, long totalRuns) {
        if (totalRuns == 0) {
            return 0.0;
        }
        return Math.round(successRuns * 10000.0 / totalRuns) / 100.0;
    }
}
