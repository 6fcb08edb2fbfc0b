package org.checkpulse.adapters.jenkins;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.checkpulse.state.InfoPair;
import org.checkpulse.utils.JsonUtil;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class JenkinsTranslatorTest {

    private static final long STARTED = 1_700_000_000_000L;
    private static final String SHA = "0123456789abcdef0123456789abcdef01234567";

    private final JenkinsTranslator translator = new JenkinsTranslator(ZoneOffset.UTC, Locale.US);

    // --- result and last successful build block ---

    @Test
    void greenJobHasNoLastSuccessfulBlock() {
        var job = job("blue", build("42", false), build("42", false));

        var report = translator.translate(job);

        assertTrue(report.result());
        assertFalse(labels(report).contains("Last Successful Build"));
    }

    @Test
    void redJobShowsLastSuccessfulBuild() {
        var job = job("red", build("43", false), build("42", false));

        var report = translator.translate(job);

        assertFalse(report.result());
        var labels = labels(report);
        int block = labels.indexOf("Last Successful Build");
        assertTrue(block > 0);
        assertEquals(new InfoPair("", ""), report.info().get(block - 1));
        assertEquals(List.of("  Name", "  Duration", "  SHA", "  Started"), labels.subList(block + 1, block + 5));
        assertEquals("my-job #42", report.info().get(block + 1).value());
        assertEquals("012345", report.info().get(block + 3).value());
    }

    @Test
    void buildingJobIsChanging() {
        var report = translator.translate(job("blue_anime", build("44", true), build("43", false)));

        assertTrue(report.result());
        assertTrue(report.changing());
        assertEquals("https://ci/job/my-job/44/console", report.url());
    }

    @Test
    void otherColorsAreFailures() {
        assertFalse(translator.translate(job("aborted", build("1", false), build("1", false))).result());
        assertFalse(translator.translate(job("notbuilt", build("1", false), build("1", false))).result());
    }

    // --- info rows ---

    @Test
    void summaryRowsComeFirst() {
        var report = translator.translate(job("blue", build("42", false), build("42", false)));

        var expectedStarted = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM)
                .withLocale(Locale.US)
                .withZone(ZoneOffset.UTC)
                .format(Instant.ofEpochMilli(STARTED));
        assertEquals(new InfoPair("Build", "my-job #42"), report.info().get(0));
        assertEquals(new InfoPair("Duration", "00:02:05"), report.info().get(1));
        assertEquals(new InfoPair("Started", expectedStarted), report.info().get(2));
        assertEquals(new InfoPair("SHA", "012345"), report.info().get(3));
    }

    @Test
    void recentChangesAreListedNewestFirst() {
        ObjectNode last = build("42", false);
        ArrayNode items = last.putObject("changeSet").putArray("items");
        items.addObject().put("msg", "older").put("commitId", "aaaaaaaaaa").putObject("author").put("fullName", "Ann");
        items.addObject().put("msg", "newer").put("commitId", "bbbbbbbbbb").putObject("author").put("fullName", "Bob");
        items.addObject().put("msg", "no id").putObject("author").put("fullName", "Cid");

        var report = translator.translate(job("blue", last, build("42", false)));

        var info = report.info();
        int header = labels(report).indexOf("Recents");
        assertEquals(new InfoPair("Author", "Cid"), info.get(header - 2));
        assertEquals(new InfoPair("", ""), info.get(header - 1));
        assertEquals(new InfoPair(" - no id", "<missing>"), info.get(header + 1));
        assertEquals(new InfoPair(" - newer", "bbbbbb"), info.get(header + 2));
        assertEquals(new InfoPair(" - older", "aaaaaa"), info.get(header + 3));
        assertEquals(header + 4, info.size());
    }

    @Test
    void noChangesMeansNoRecentsBlock() {
        var report = translator.translate(job("blue", build("42", false), build("42", false)));

        assertFalse(labels(report).contains("Recents"));
        assertFalse(labels(report).contains("Author"));
    }

    @Test
    void shaIsOmittedWithoutRevision() {
        ObjectNode last = build("42", false);
        last.putArray("actions").addObject();

        var report = translator.translate(job("blue", last, build("42", false)));

        assertFalse(labels(report).contains("SHA"));
    }

    @Test
    void jobWithoutBuildsHasNoInfo() throws Exception {
        JsonNode job = JsonUtil.mapper().readTree("{\"name\": \"new\", \"color\": \"notbuilt\", \"lastBuild\": null}");

        var report = translator.translate(job);

        assertFalse(report.result());
        assertNull(report.url());
        assertTrue(report.info().isEmpty());
    }

    // --- formatting ---

    @Test
    void formatsDurations() {
        assertEquals("00:02:05", JenkinsTranslator.formatDuration(125_000));
        assertEquals("00:00:00", JenkinsTranslator.formatDuration(999));
        assertEquals("01:01:01", JenkinsTranslator.formatDuration(3_661_000));
        assertEquals("27:00:00", JenkinsTranslator.formatDuration(97_200_000));
    }

    @Test
    void shortensShas() {
        assertEquals("012345", JenkinsTranslator.sha6(SHA));
        assertEquals(6, JenkinsTranslator.sha6(SHA).length());
        assertEquals("abc", JenkinsTranslator.sha6("abc"));
    }

    private static List<String> labels(StatusReport report) {
        return report.info().stream().map(InfoPair::label).toList();
    }

    private static ObjectNode job(String color, ObjectNode lastBuild, ObjectNode lastSuccessfulBuild) {
        ObjectNode job = JsonUtil.mapper().createObjectNode();
        job.put("name", "my-job");
        job.put("color", color);
        job.set("lastBuild", lastBuild);
        job.set("lastSuccessfulBuild", lastSuccessfulBuild);
        return job;
    }

    private static ObjectNode build(String id, boolean building) {
        ObjectNode build = JsonUtil.mapper().createObjectNode();
        build.put("id", id);
        build.put("building", building);
        build.put("fullDisplayName", "my-job #" + id);
        build.put("url", "https://ci/job/my-job/" + id + "/");
        build.put("timestamp", STARTED);
        build.put("duration", 125_000);
        ArrayNode actions = build.putArray("actions");
        actions.addObject();
        actions.addObject().putObject("lastBuiltRevision").put("SHA1", SHA);
        return build;
    }
}
