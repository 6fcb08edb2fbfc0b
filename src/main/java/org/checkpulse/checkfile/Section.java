package org.checkpulse.checkfile;

/**
 * A visual group inside a checkfile. {@code title} is null for a bare {@code #-} separator.
 */
public record Section(String title, int firstCheckIndex) {
}
