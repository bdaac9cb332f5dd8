package org.lite.telemetry.enums;

/**
 * How a span collection with more than one parentless span picks its root.
 */
public enum MultipleRootPolicy {
    FIRST_ENCOUNTERED,  // first parentless span in input order
    NONE                // ambiguous traces are treated as rootless
}
