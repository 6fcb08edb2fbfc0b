package org.checkpulse.adapters.jenkins;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Serialises a field spec into the Jenkins {@code tree=} selector.
 * <p>
 * {@code {name: true, lastBuild: {id: true}}} becomes {@code name,lastBuild\[id\]}: nested maps
 * as {@code key[children]}, plain fields as bare names. The escaped form is safe to paste into
 * a shell; {@link #plain(Map)} is what goes into request URLs.
 */
public final class TreeSelector {

    private TreeSelector() {}

    public static String shellEscaped(Map<String, ?> spec) {
        return render(spec, "\\[", "\\]");
    }

    public static String plain(Map<String, ?> spec) {
        return render(spec, "[", "]");
    }

    private static String render(Map<String, ?> spec, String open, String close) {
        StringJoiner joiner = new StringJoiner(",");
        for (Map.Entry<String, ?> e : spec.entrySet()) {
            Object value = e.getValue();
            if (value instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, ?> children = (Map<String, ?>) nested;
                joiner.add(e.getKey() + open + render(children, open, close) + close);
            } else if (Boolean.TRUE.equals(value)) {
                joiner.add(e.getKey());
            }
        }
        return joiner.toString();
    }
}
