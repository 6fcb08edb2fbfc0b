package org.checkpulse.adapters.jenkins;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Builds the Jenkins API URLs and locates the job object in the response.
 */
public class JenkinsApi {

    private static final Logger logger = LoggerFactory.getLogger(JenkinsApi.class);

    private final String baseUrl;
    private final boolean rootApi;
    private final boolean pretty;
    private final UpstreamFetcher fetcher;
    private final ObjectMapper mapper;

    public JenkinsApi(String baseUrl, boolean rootApi, boolean pretty, UpstreamFetcher fetcher, ObjectMapper mapper) {
        this.baseUrl = stripTrailingSlashes(baseUrl);
        this.rootApi = rootApi;
        this.pretty = pretty;
        this.fetcher = fetcher;
        this.mapper = mapper;
    }

    public URI jobUri(String jobName) {
        String url = baseUrl + "/job/" + encode(jobName) + "/api/json?depth=1&tree="
                + encode(TreeSelector.plain(JenkinsFields.JOB));
        return URI.create(withPretty(url));
    }

    public URI rootUri() {
        String url = baseUrl + "/api/json?depth=2&tree=" + encode(TreeSelector.plain(JenkinsFields.rootSpec()));
        return URI.create(withPretty(url));
    }

    /**
     * Fetches the job object, either directly or by picking it out of the root listing.
     */
    public JsonNode fetchJob(String jobName) throws UpstreamFetchException, JobNotFoundException {
        if (!rootApi) {
            URI uri = jobUri(jobName);
            logger.debug("Fetching job {} (tree={})", jobName, TreeSelector.shellEscaped(JenkinsFields.JOB));
            JsonNode job = readJson(uri, fetcher.fetch(uri));
            if (!job.isObject()) {
                throw new UpstreamFetchException("Unexpected response from " + uri + ": not a JSON object");
            }
            return job;
        }

        URI uri = rootUri();
        logger.debug("Fetching all jobs (tree={})", TreeSelector.shellEscaped(JenkinsFields.rootSpec()));
        JsonNode root = readJson(uri, fetcher.fetch(uri));
        for (JsonNode job : root.path("jobs")) {
            if (jobName.equals(job.path("name").asText(null))) {
                return job;
            }
        }
        throw new JobNotFoundException(jobName);
    }

    private JsonNode readJson(URI uri, String body) throws UpstreamFetchException {
        if (body == null || body.isBlank()) {
            throw new UpstreamFetchException("Empty response from " + uri);
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamFetchException("Invalid JSON from " + uri + ": " + e.getOriginalMessage(), e);
        }
    }

    private String withPretty(String url) {
        return pretty ? url + "&pretty=true" : url;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlashes(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
