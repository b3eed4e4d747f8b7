package com.jdc.catalog_manager.config;

import org.hibernate.dialect.MySQLDialect;
import org.hibernate.engine.jdbc.dialect.spi.DialectResolutionInfo;

/**
 * MySQL dialect whose generated tables use the binary {@code utf8mb4_bin} collation.
 * The server default ({@code utf8mb4_0900_ai_ci}) folds case and accents, which would make
 * "Jajka" and "jajka" collide on {@code uk_catalog_items_name} and match each other in lookups.
 * Binary collation also orders names by code point.
 *
 * <p>Only affects tables Hibernate creates. Tables that already exist must be converted with
 * {@code ALTER TABLE ... CONVERT TO CHARACTER SET utf8mb4 COLLATE utf8mb4_bin}.
 */
public class BinaryCollationMySQLDialect extends MySQLDialect {

    static final String TABLE_OPTIONS = " default charset=utf8mb4 collate=utf8mb4_bin";

    public BinaryCollationMySQLDialect() {
        super();
    }

    public BinaryCollationMySQLDialect(DialectResolutionInfo info) {
        super(info);
    }

    @Override
    public String getTableTypeString() {
        return super.getTableTypeString() + TABLE_OPTIONS;
    }
}
