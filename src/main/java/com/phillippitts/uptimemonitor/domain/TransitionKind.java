package com.phillippitts.uptimemonitor.domain;

/**
 * Kind of status change a notification reports.
 */
public enum TransitionKind {
    /** First confirmed failure after being up (or unknown). */
    DOWN,
    /** Recovery after a confirmed failure. */
    UP,
    /** Repeated reminder while the monitor stays down. */
    STILL_DOWN
}
