package com.di.silverline.exception;

import java.time.Duration;

public class TimeoutExceededException extends IngestionException {

    private final String step;
    private final Duration budget;

    public TimeoutExceededException(String step, Duration budget) {
        super(ErrorKind.TIMEOUT_EXCEEDED, String.format("Step '%s' exceeded its budget of %s", step, budget));
        this.step = step;
        this.budget = budget;
    }

    public String getStep() {
        return step;
    }

    public Duration getBudget() {
        return budget;
    }
}
