package org.checkpulse.adapters.jenkins;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields requested from the Jenkins JSON API. A value is either {@code Boolean.TRUE} for a
 * plain field or a nested map for a structured one.
 */
public final class JenkinsFields {

    public static final Map<String, Object> BUILD = build();
    public static final Map<String, Object> JOB = job();

    private JenkinsFields() {}

    private static Map<String, Object> build() {
        Map<String, Object> author = new LinkedHashMap<>();
        author.put("fullName", true);

        Map<String, Object> items = new LinkedHashMap<>();
        items.put("msg", true);
        items.put("commitId", true);
        items.put("author", author);

        Map<String, Object> changeSet = new LinkedHashMap<>();
        changeSet.put("items", items);

        Map<String, Object> revision = new LinkedHashMap<>();
        revision.put("SHA1", true);

        Map<String, Object> actions = new LinkedHashMap<>();
        actions.put("lastBuiltRevision", revision);

        Map<String, Object> build = new LinkedHashMap<>();
        build.put("id", true);
        build.put("result", true);
        build.put("building", true);
        build.put("fullDisplayName", true);
        build.put("url", true);
        build.put("timestamp", true);
        build.put("duration", true);
        build.put("changeSet", changeSet);
        build.put("actions", actions);
        return Collections.unmodifiableMap(build);
    }

    private static Map<String, Object> job() {
        Map<String, Object> job = new LinkedHashMap<>();
        job.put("name", true);
        job.put("color", true);
        job.put("lastBuild", BUILD);
        job.put("lastSuccessfulBuild", BUILD);
        return Collections.unmodifiableMap(job);
    }

    /**
     * The job spec nested under {@code jobs}, for the aggregate endpoint.
     */
    public static Map<String, Object> rootSpec() {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("jobs", JOB);
        return root;
    }
}
