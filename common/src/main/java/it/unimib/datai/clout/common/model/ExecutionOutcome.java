package it.unimib.datai.clout.common.model;

public enum ExecutionOutcome {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
