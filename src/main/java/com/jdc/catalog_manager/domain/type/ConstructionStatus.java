package com.jdc.catalog_manager.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConstructionStatus {
    ACTIVE("active"),
    IN_PROGRESS("in_progress"),
    INACTIVE("inactive"),
    ARCHIVED("archived"),
    DELETED("deleted"),
    COMPLETED("completed"),
    PLANNED("planned");

    private final String code;

    ConstructionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ConstructionStatus fromCode(String code) {
        for (ConstructionStatus s : values()) {
            if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Invalid construction status: " + code);
    }
}
