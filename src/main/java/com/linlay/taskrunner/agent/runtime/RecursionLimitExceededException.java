package com.linlay.taskrunner.agent.runtime;

public class RecursionLimitExceededException extends CapabilityException {

    private final int limit;

    public RecursionLimitExceededException(int limit) {
        super("Recursion limit of " + limit + " reached without hitting a stop condition");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
