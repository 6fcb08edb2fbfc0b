package org.checkpulse.adapters.jenkins;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.checkpulse.config.utils.LogContext;
import org.checkpulse.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Check executable reporting the status of one Jenkins job.
 * <pre>
 *   jenkins-status https://ci.example.com my-job
 * </pre>
 * Prints the check result JSON on stdout; anything else goes to stderr.
 */
@Command(
        name = "jenkins-status",
        mixinStandardHelpOptions = true,
        version = "jenkins-status 1.0.0",
        description = "Report the status of a Jenkins job as a check result."
)
public class JenkinsStatusCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(JenkinsStatusCommand.class);

    static final int EXIT_FAILURE = 1;

    @Parameters(index = "0", paramLabel = "JENKINS_URL", description = "Base URL of the Jenkins server")
    String baseUrl;

    @Parameters(index = "1", paramLabel = "JOB", description = "Name of the job")
    String jobName;

    @Option(names = "--root-api", description = "Query the server root listing instead of the job endpoint")
    boolean rootApi;

    @Option(names = "--pretty-api", description = "Ask Jenkins for indented JSON")
    boolean prettyApi;

    @Option(names = "--timeout", defaultValue = "30", paramLabel = "SECONDS",
            description = "HTTP timeout in seconds (default: ${DEFAULT-VALUE})")
    int timeoutSeconds;

    @Spec
    CommandSpec spec;

    private final UpstreamFetcher fetcher;
    private final JenkinsTranslator translator;
    private final ObjectMapper mapper = JsonUtil.mapper();

    public JenkinsStatusCommand() {
        this(null, new JenkinsTranslator());
    }

    /**
     * @param fetcher upstream fetcher, or null to use HTTP with the {@code --timeout} option
     */
    public JenkinsStatusCommand(UpstreamFetcher fetcher, JenkinsTranslator translator) {
        this.fetcher = fetcher;
        this.translator = translator;
    }

    @Override
    public Integer call() {
        LogContext.start("JenkinsStatus", jobName);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            UpstreamFetcher upstream = fetcher != null ? fetcher
                    : new HttpUpstreamFetcher(Duration.ofSeconds(Math.max(1, timeoutSeconds)));
            JenkinsApi api = new JenkinsApi(baseUrl, rootApi, prettyApi, upstream, mapper);

            JsonNode job = api.fetchJob(jobName);
            StatusReport report = translator.translate(job);

            out.println(mapper.writeValueAsString(report));
            out.flush();
            return CommandLine.ExitCode.OK;
        } catch (UpstreamFetchException | JobNotFoundException e) {
            logger.debug("Jenkins status failed for {}", jobName, e);
            err.println(e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        } catch (JsonProcessingException e) {
            err.println("Cannot serialise result: " + e.getOriginalMessage());
            err.flush();
            return EXIT_FAILURE;
        } finally {
            LogContext.clear();
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JenkinsStatusCommand()).execute(args);
        System.exit(exitCode);
    }
}
