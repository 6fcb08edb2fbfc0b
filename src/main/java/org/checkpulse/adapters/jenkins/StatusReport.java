package org.checkpulse.adapters.jenkins;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.checkpulse.state.InfoPair;

import java.util.List;

/**
 * The result document an adapter prints on stdout.
 */
@JsonPropertyOrder({"result", "changing", "url", "info"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusReport(boolean result, boolean changing, String url, List<InfoPair> info) {

    public StatusReport {
        info = info == null ? List.of() : List.copyOf(info);
    }
}
