package org.brown.coderunner.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {

    SUCCESS("success"),
    ERROR("error");

    private final String wireName;

    ExecutionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
