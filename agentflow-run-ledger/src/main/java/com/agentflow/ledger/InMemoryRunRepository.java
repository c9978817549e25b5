package com.agentflow.ledger;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** Thread-safe in-process repository; keeps every run for the life of the process. */
public final class InMemoryRunRepository implements RunRepository {

    private final Map<String, StoredRun> runs = new ConcurrentHashMap<>();

    @Override
    public String create(RunRecord run) {
        String id = UUID.randomUUID().toString();
        runs.put(id, new StoredRun(id, run, null));
        return id;
    }

    @Override
    public void update(String runId, RunCompletion completion) {
        StoredRun existing = runs.get(runId);
        if (existing == null) {
            throw new IllegalArgumentException("Unknown run id: " + runId);
        }
        runs.put(runId, new StoredRun(runId, existing.getRecord(), completion));
    }

    public Optional<StoredRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public int size() {
        return runs.size();
    }

    /** A run as stored: the start record plus the completion once the run has ended. */
    public static final class StoredRun {
        private final String id;
        private final RunRecord record;
        private final RunCompletion completion;

        StoredRun(String id, RunRecord record, RunCompletion completion) {
            this.id = id;
            this.record = record;
            this.completion = completion;
        }

        public String getId() { return id; }
        public RunRecord getRecord() { return record; }
        public RunCompletion getCompletion() { return completion; }

        public RunStatus getStatus() {
            return completion != null ? completion.getStatus() : RunStatus.RUNNING;
        }
    }
}
