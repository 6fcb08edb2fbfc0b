package org.checkpulse.adapters.jenkins;

import com.fasterxml.jackson.databind.JsonNode;
import org.checkpulse.state.InfoPair;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Translates a Jenkins job object into a {@link StatusReport}.
 */
public class JenkinsTranslator {

    static final Set<String> PASSING_COLORS = Set.of("blue", "blue_anime");
    static final InfoPair SEPARATOR = new InfoPair("", "");
    static final String MISSING = "<missing>";

    private final DateTimeFormatter startedFormat;

    public JenkinsTranslator(ZoneId zone, Locale locale) {
        this.startedFormat = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM)
                .withLocale(locale)
                .withZone(zone);
    }

    public JenkinsTranslator() {
        this(ZoneId.systemDefault(), Locale.getDefault());
    }

    public StatusReport translate(JsonNode job) {
        boolean result = PASSING_COLORS.contains(job.path("color").asText(""));
        JsonNode lastBuild = job.path("lastBuild");

        if (!lastBuild.isObject()) {
            return new StatusReport(result, false, null, List.of());
        }

        boolean changing = lastBuild.path("building").asBoolean(false);
        String url = lastBuild.hasNonNull("url") ? lastBuild.get("url").asText() + "console" : null;

        List<InfoPair> info = new ArrayList<>();
        info.add(new InfoPair("Build", lastBuild.path("fullDisplayName").asText("")));
        info.add(new InfoPair("Duration", formatDuration(lastBuild.path("duration").asLong(0))));
        info.add(new InfoPair("Started", formatStarted(lastBuild.path("timestamp").asLong(0))));
        revision(lastBuild).ifPresent(sha -> info.add(new InfoPair("SHA", sha6(sha))));

        JsonNode items = lastBuild.path("changeSet").path("items");
        if (items.isArray() && items.size() > 0) {
            JsonNode author = items.get(items.size() - 1).path("author").path("fullName");
            if (author.isTextual()) {
                info.add(new InfoPair("Author", author.asText()));
            }

            info.add(SEPARATOR);
            info.add(new InfoPair("Recents", ""));
            for (int i = items.size() - 1; i >= 0; i--) {
                JsonNode item = items.get(i);
                String commitId = item.path("commitId").asText("");
                info.add(new InfoPair(" - " + item.path("msg").asText(""),
                        commitId.isEmpty() ? MISSING : sha6(commitId)));
            }
        }

        JsonNode lastSuccessful = job.path("lastSuccessfulBuild");
        if (lastSuccessful.isObject() && !sameBuild(lastBuild, lastSuccessful)) {
            info.add(SEPARATOR);
            info.add(new InfoPair("Last Successful Build", ""));
            info.add(new InfoPair("  Name", lastSuccessful.path("fullDisplayName").asText("")));
            info.add(new InfoPair("  Duration", formatDuration(lastSuccessful.path("duration").asLong(0))));
            info.add(new InfoPair("  SHA", revision(lastSuccessful).map(JenkinsTranslator::sha6).orElse(MISSING)));
            info.add(new InfoPair("  Started", formatStarted(lastSuccessful.path("timestamp").asLong(0))));
        }

        return new StatusReport(result, changing, url, info);
    }

    /**
     * Milliseconds as {@code HH:MM:SS}; hours are not wrapped at 24.
     */
    public static String formatDuration(long millis) {
        long totalSeconds = Math.max(0, millis) / 1000;
        return String.format("%02d:%02d:%02d", totalSeconds / 3600, (totalSeconds % 3600) / 60, totalSeconds % 60);
    }

    public static String sha6(String sha) {
        return sha.length() <= 6 ? sha : sha.substring(0, 6);
    }

    String formatStarted(long epochMillis) {
        return startedFormat.format(Instant.ofEpochMilli(epochMillis));
    }

    private static boolean sameBuild(JsonNode a, JsonNode b) {
        return a.path("id").asText("").equals(b.path("id").asText(""));
    }

    // first lastBuiltRevision among the build actions; most actions are empty objects
    private static Optional<String> revision(JsonNode build) {
        for (JsonNode action : build.path("actions")) {
            JsonNode sha = action.path("lastBuiltRevision").path("SHA1");
            if (sha.isTextual() && !sha.asText().isEmpty()) {
                return Optional.of(sha.asText());
            }
        }
        return Optional.empty();
    }
}
