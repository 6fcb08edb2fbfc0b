package org.checkpulse.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import org.checkpulse.runner.RunResult;
import org.checkpulse.state.CheckStatus;
import org.checkpulse.state.InfoPair;
import org.checkpulse.utils.JsonUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates a check's stdout against the result contract:
 * <pre>
 * {"result": bool, "changing"?: bool, "url"?: string|null, "info"?: [[string, string], ...]}
 * </pre>
 */
public class ContractParser {

    private static final ObjectReader READER = JsonUtil.mapper()
            .readerFor(JsonNode.class)
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    /**
     * Classifies a finished run. Valid JSON wins over a non-zero exit code.
     */
    public CheckResult interpret(RunResult run) {
        switch (run.termination()) {
            case SPAWN_FAILED:
                return CheckResult.error("Command could not be started: " + firstLine(run.stderr()), null);
            case TIMED_OUT:
                return CheckResult.error("Command timed out", null);
            case INTERRUPTED:
                return CheckResult.error("Command was interrupted before it finished", null);
            default:
                break;
        }

        try {
            return parse(run.stdout());
        } catch (ContractViolationException e) {
            String message = e.getMessage();
            if (run.exitCode() != 0 && !run.stderr().isBlank()) {
                message = message + " (stderr: " + firstLine(run.stderr()) + ")";
            }
            return CheckResult.error(message, run.exitCode());
        }
    }

    public CheckResult parse(String stdout) throws ContractViolationException {
        if (stdout == null || stdout.isBlank()) {
            throw new ContractViolationException("No output on stdout");
        }

        JsonNode root;
        try {
            root = READER.readValue(stdout);
        } catch (JsonProcessingException e) {
            throw new ContractViolationException("Output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ContractViolationException("Output must be a JSON object");
        }

        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new ContractViolationException("Missing required field 'result'");
        }
        if (!result.isBoolean()) {
            throw new ContractViolationException("Field 'result' must be a boolean");
        }

        boolean changing = false;
        JsonNode changingNode = root.get("changing");
        if (changingNode != null && !changingNode.isNull()) {
            if (!changingNode.isBoolean()) {
                throw new ContractViolationException("Field 'changing' must be a boolean");
            }
            changing = changingNode.booleanValue();
        }

        String url = null;
        JsonNode urlNode = root.get("url");
        if (urlNode != null && !urlNode.isNull()) {
            if (!urlNode.isTextual()) {
                throw new ContractViolationException("Field 'url' must be a string or null");
            }
            url = urlNode.textValue();
        }

        List<InfoPair> info = parseInfo(root.get("info"));
        CheckStatus status = result.booleanValue() ? CheckStatus.OK : CheckStatus.FAILING;
        return new CheckResult(status, changing, url, info);
    }

    private static List<InfoPair> parseInfo(JsonNode infoNode) throws ContractViolationException {
        if (infoNode == null || infoNode.isNull()) return List.of();
        if (!infoNode.isArray()) {
            throw new ContractViolationException("Field 'info' must be an array");
        }

        List<InfoPair> info = new ArrayList<>(infoNode.size());
        for (int i = 0; i < infoNode.size(); i++) {
            JsonNode entry = infoNode.get(i);
            if (!entry.isArray() || entry.size() != 2) {
                throw new ContractViolationException("info[" + i + "] must be a two-element array");
            }
            if (!entry.get(0).isTextual() || !entry.get(1).isTextual()) {
                throw new ContractViolationException("info[" + i + "] must contain two strings");
            }
            info.add(new InfoPair(entry.get(0).textValue(), entry.get(1).textValue()));
        }
        return info;
    }

    private static String firstLine(String text) {
        if (text == null) return "";
        String trimmed = text.strip();
        int nl = trimmed.indexOf('\n');
        return nl < 0 ? trimmed : trimmed.substring(0, nl);
    }
}
