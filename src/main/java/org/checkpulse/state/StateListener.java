package org.checkpulse.state;

/**
 * Notified after the store applied a change. {@code previous} is null for a new check,
 * {@code current} is null for a removed one.
 */
@FunctionalInterface
public interface StateListener {

    void stateChanged(CheckState previous, CheckState current);
}
