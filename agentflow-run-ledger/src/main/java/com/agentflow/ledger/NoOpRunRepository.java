package com.agentflow.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/** Repository used when the run ledger is disabled. Hands out ids; stores nothing. */
public final class NoOpRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(NoOpRunRepository.class);

    @Override
    public String create(RunRecord run) {
        String id = UUID.randomUUID().toString();
        log.debug("Run repository (no-op): create | runId={} | workflow={} | persistence skipped", id, run.getWorkflowName());
        return id;
    }

    @Override
    public void update(String runId, RunCompletion completion) {
        log.debug("Run repository (no-op): update | runId={} | status={}", runId, completion.getStatus().toValue());
    }
}
