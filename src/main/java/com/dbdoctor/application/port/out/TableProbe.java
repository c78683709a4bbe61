package com.dbdoctor.application.port.out;

/**
 * Port for asking the live database whether a table exists.
 * Not cached: a long interactive session may see the schema change.
 */
public interface TableProbe {
    boolean exists(String table);
}
