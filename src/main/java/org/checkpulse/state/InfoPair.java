package org.checkpulse.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Objects;

/**
 * One (label, value) row of a check's info list. Serialised as a two-element JSON array.
 */
public record InfoPair(String label, String value) {

    public InfoPair {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(value, "value");
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static InfoPair of(List<String> pair) {
        if (pair == null || pair.size() != 2) {
            throw new IllegalArgumentException("info entry must have exactly two elements");
        }
        return new InfoPair(pair.get(0), pair.get(1));
    }

    @JsonValue
    public List<String> asList() {
        return List.of(label, value);
    }
}
