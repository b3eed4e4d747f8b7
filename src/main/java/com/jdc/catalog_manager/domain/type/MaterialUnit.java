package com.jdc.catalog_manager.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MaterialUnit {
    METERS("meters"),
    KILOGRAMS("kilograms"),
    CUBIC_METERS("cubic_meters"),
    CUBIC_CENTIMETERS("cubic_centimeters"),
    CUBIC_MILLIMETERS("cubic_millimeters"),
    LITERS("liters"),
    PIECES("pieces"),
    OTHER("other");

    private final String code;

    MaterialUnit(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static MaterialUnit fromCode(String code) {
        for (MaterialUnit u : values()) {
            if (u.code.equalsIgnoreCase(code) || u.name().equalsIgnoreCase(code)) {
                return u;
            }
        }
        throw new IllegalArgumentException("Invalid material unit: " + code);
    }
}
