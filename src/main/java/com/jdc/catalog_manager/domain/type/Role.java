package com.jdc.catalog_manager.domain.type;

public enum Role {
    USER,
    ADMIN
}
