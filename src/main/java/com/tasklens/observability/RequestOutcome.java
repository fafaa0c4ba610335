package com.tasklens.observability;

public enum RequestOutcome {
    OK("ok"),
    ERROR("error"),
    CANCELED("canceled");

    private final String tagValue;

    RequestOutcome(String tagValue) {
        this.tagValue = tagValue;
    }

    public String tagValue() {
        return tagValue;
    }
}
