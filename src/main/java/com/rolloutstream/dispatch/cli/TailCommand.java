package com.rolloutstream.dispatch.cli;

import com.rolloutstream.cluster.ReleaseNotFoundException;
import com.rolloutstream.core.logs.EventMultiplexer;
import com.rolloutstream.core.logs.LogStreamEngine;
import com.rolloutstream.core.logs.LogStreamSession;
import com.rolloutstream.core.logs.StreamMessage;
import com.rolloutstream.core.model.LogEvent;
import com.rolloutstream.core.model.PodInfo;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.SourceFilter;
import com.rolloutstream.core.model.StreamSubscription;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: rollout-stream tail &lt;namespace/name&gt;
 * <p>
 * Follows every pod of the rollout's current revision and its test jobs, printing
 * lines as they arrive until interrupted. On Ctrl+C the Spring context shutdown closes
 * the session.
 */
@Command(name = "tail", mixinStandardHelpOptions = true, description = "Follow the logs of a rollout")
@Component
public class TailCommand implements Callable<Integer> {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    @Parameters(index = "0", description = "Rollout as namespace/name")
    private String release;

    @Option(names = {"--type", "-t"}, description = "Only this source type: workload or job")
    private String type;

    @Option(names = {"--since", "-s"},
            description = "Only lines newer than this, as an ISO-8601 duration (e.g. PT10M)")
    private Duration since;

    @Option(names = "--for", description = "Stop after this long (ISO-8601 duration); runs until interrupted when unset")
    private Duration runFor;

    private final LogStreamEngine logStreamEngine;

    public TailCommand(LogStreamEngine logStreamEngine) {
        this.logStreamEngine = logStreamEngine;
    }

    @Override
    public Integer call() throws InterruptedException {
        ReleaseRef ref;
        SourceFilter filter;
        try {
            ref = ReleaseRef.parse(release);
            filter = SourceFilter.parse(type);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        Instant sinceTime = since != null ? Instant.now().minus(since) : null;

        LogStreamSession session;
        try {
            session = logStreamEngine.open(new StreamSubscription(ref, filter, sinceTime));
        } catch (ReleaseNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Following " + ref + (filter.only() != null ? " (" + filter.only().wireName() + " only)" : ""));
        long deadline = runFor != null ? System.nanoTime() + runFor.toNanos() : Long.MAX_VALUE;
        try {
            List<PodInfo> lastRoster = List.of();
            while (!session.isFinished() && System.nanoTime() < deadline) {
                StreamMessage message = session.poll(POLL_INTERVAL);
                if (message == null) {
                    continue;
                }
                switch (message.event()) {
                    case EventMultiplexer.LOG_EVENT -> ConsoleOutput.logLine((LogEvent) message.data());
                    case EventMultiplexer.PODS_EVENT -> lastRoster = printRosterChange(lastRoster, message);
                    default -> { }
                }
            }
        } finally {
            session.close();
        }
        return 0;
    }

    @SuppressWarnings("unchecked")
    private static List<PodInfo> printRosterChange(List<PodInfo> previous, StreamMessage message) {
        List<PodInfo> pods = (List<PodInfo>) message.data();
        if (!pods.equals(previous)) {
            ConsoleOutput.roster(pods);
        }
        return pods;
    }
}
