package org.checkpulse.state;

public enum CheckStatus {
    /** Not run yet, or first run still in flight. */
    PENDING,
    OK,
    FAILING,
    /** Command could not run or broke the result contract. */
    ERROR
}
