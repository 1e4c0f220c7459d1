package opsqueue.jobs.model;

/**
 * Combined result of a tick; a step that was skipped is null.
 */
public record TickResult(RecoveryResult recovered, EnqueueDueResult scheduled, RunResult run) {
}
