package com.schedq.history;

import com.schedq.JobContext;
import com.schedq.RunStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryExecutionHistory implements ExecutionHistory {

    private static final int MAX_RESULT_LENGTH = 1000;

    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();

    @Override
    public void recordStart(String ownerCode, JobContext context) {
        records.put(context.runId(), ExecutionRecord.started(ownerCode, context));
    }

    @Override
    public void recordSuccess(String ownerCode, JobContext context, Instant endTime, Object result) {
        finish(ownerCode, context, endTime, RunStatus.SUCCEEDED, abbreviate(result), null);
    }

    @Override
    public void recordFailure(String ownerCode, JobContext context, Instant endTime, Throwable error,
                              boolean willRetry) {
        finish(ownerCode, context, endTime,
                willRetry ? RunStatus.FAILED_RETRY_PENDING : RunStatus.FAILED_FINAL, null, error);
    }

    @Override
    public void recordSkip(String ownerCode, JobContext context, RunStatus reason) {
        records.put(context.runId(), ExecutionRecord.started(ownerCode, context)
                .finish(context.startTime() != null ? context.startTime() : context.scheduledTime(),
                        reason, null, null));
    }

    private void finish(String ownerCode, JobContext context, Instant endTime, RunStatus status, String result,
                        Throwable error) {
        records.compute(context.runId(), (runId, existing) ->
                (existing != null ? existing : ExecutionRecord.started(ownerCode, context))
                        .finish(endTime, status, result, error));
    }

    @Override
    public Optional<ExecutionRecord> find(String runId) {
        return Optional.ofNullable(records.get(runId));
    }

    @Override
    public List<ExecutionRecord> findByJob(String ownerCode, int limit) {
        return records.values().stream()
                .filter(record -> record.ownerCode().equals(ownerCode))
                .sorted(Comparator.comparing(InMemoryExecutionHistory::sortKey).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public int deleteFinishedBefore(Instant threshold) {
        int before = records.size();
        records.values().removeIf(record -> record.endTime() != null && record.endTime().isBefore(threshold));
        return before - records.size();
    }

    private static Instant sortKey(ExecutionRecord record) {
        if (record.startTime() != null) {
            return record.startTime();
        }
        return record.scheduledTime() != null ? record.scheduledTime() : Instant.EPOCH;
    }

    private static String abbreviate(Object result) {
        if (result == null) {
            return null;
        }
        String text = String.valueOf(result);
        return text.length() <= MAX_RESULT_LENGTH ? text : text.substring(0, MAX_RESULT_LENGTH) + "...";
    }
}
