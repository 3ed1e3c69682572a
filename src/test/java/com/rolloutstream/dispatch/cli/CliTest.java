package com.rolloutstream.dispatch.cli;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ReleaseNotFoundException;
import com.rolloutstream.core.health.HealthCheckService;
import com.rolloutstream.core.health.HealthStatus;
import com.rolloutstream.core.logs.EventMultiplexer;
import com.rolloutstream.core.logs.LogStreamEngine;
import com.rolloutstream.core.logs.LogStreamSession;
import com.rolloutstream.core.logs.StreamMessage;
import com.rolloutstream.core.model.LogEvent;
import com.rolloutstream.core.model.PodInfo;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.SourceFilter;
import com.rolloutstream.core.model.SourceType;
import com.rolloutstream.core.model.StreamSubscription;
import com.rolloutstream.core.model.Target;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the rollout-stream CLI command structure.
 * Commands are built through a picocli factory with mocked services, no Spring context.
 */
class CliTest {

    private static final ReleaseRef RELEASE = new ReleaseRef("shop", "checkout");

    private record CliResult(int exitCode, String output) {}

    private CommandLine.IFactory createFactory(LogStreamEngine engine, HealthCheckService healthService) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == TargetsCommand.class) {
                    return (K) new TargetsCommand(engine);
                }
                if (cls == TailCommand.class) {
                    return (K) new TailCommand(engine);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(LogStreamEngine.class), mock(HealthCheckService.class), args);
    }

    private CliResult execute(LogStreamEngine engine, HealthCheckService healthService, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new RolloutStreamCommand(), createFactory(engine, healthService));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help includes all subcommands")
        void helpIncludesAllSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("serve"));
            assertTrue(result.output().contains("tail"));
            assertTrue(result.output().contains("targets"));
            assertTrue(result.output().contains("health"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArgsPrintsUsage() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("ROLLOUT-STREAM"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("rollout-stream 0.1.0"));
        }

        @Test
        @DisplayName("tail --help documents the options")
        void tailHelp() {
            CliResult result = execute("tail", "--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("--type"));
            assertTrue(result.output().contains("--since"));
        }
    }

    @Nested
    @DisplayName("targets")
    class TargetsTests {

        @Test
        @DisplayName("prints each resolved target")
        void printsTargets() {
            LogStreamEngine engine = mock(LogStreamEngine.class);
            when(engine.resolveTargets(RELEASE, SourceFilter.ALL)).thenReturn(List.of(
                    Target.workload("shop", "checkout-7d9f", "7d9f"),
                    Target.job("shop", "checkout-smoke")));

            CliResult result = execute(engine, mock(HealthCheckService.class), "targets", "shop/checkout");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("2 log target(s)"));
            assertTrue(result.output().contains("rs/shop/checkout-7d9f"));
            assertTrue(result.output().contains("job/shop/checkout-smoke"));
        }

        @Test
        @DisplayName("passes the --type filter through")
        void typeFilter() {
            LogStreamEngine engine = mock(LogStreamEngine.class);
            when(engine.resolveTargets(RELEASE, new SourceFilter(SourceType.JOB))).thenReturn(List.of());

            CliResult result = execute(engine, mock(HealthCheckService.class), "targets", "shop/checkout", "--type", "test");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No log targets"));
        }

        @Test
        @DisplayName("malformed rollout reference exits with 2")
        void badReference() {
            LogStreamEngine engine = mock(LogStreamEngine.class);

            CliResult result = execute(engine, mock(HealthCheckService.class), "targets", "checkout");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("namespace/name"));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("missing rollout exits with 1")
        void missingRelease() {
            LogStreamEngine engine = mock(LogStreamEngine.class);
            when(engine.resolveTargets(any(), any())).thenThrow(new ReleaseNotFoundException(RELEASE));

            CliResult result = execute(engine, mock(HealthCheckService.class), "targets", "shop/checkout");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("not found"));
        }

        @Test
        @DisplayName("cluster error exits with 1")
        void clusterError() {
            LogStreamEngine engine = mock(LogStreamEngine.class);
            when(engine.resolveTargets(any(), any())).thenThrow(new ClusterAccessException("Cluster API unreachable"));

            CliResult result = execute(engine, mock(HealthCheckService.class), "targets", "shop/checkout");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("unreachable"));
        }
    }

    @Nested
    @DisplayName("tail")
    class TailTests {

        @Test
        @DisplayName("prints log lines and roster changes, then closes the session")
        void printsStream() throws Exception {
            LogStreamSession session = mock(LogStreamSession.class);
            when(session.isFinished()).thenReturn(false, false, false, true);
            when(session.poll(any(Duration.class))).thenReturn(
                    new StreamMessage(EventMultiplexer.PODS_EVENT, List.of(
                            new PodInfo("checkout-abc", "shop", SourceType.WORKLOAD))),
                    new StreamMessage(EventMultiplexer.LOG_EVENT,
                            new LogEvent("checkout-abc", "app", SourceType.WORKLOAD, "listening on :8080", 1700000000000L)),
                    null);
            LogStreamEngine engine = mock(LogStreamEngine.class);
            when(engine.open(any(StreamSubscription.class))).thenReturn(session);

            CliResult result = execute(engine, mock(HealthCheckService.class), "tail", "shop/checkout");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Following shop/checkout"));
            assertTrue(result.output().contains("1 pod: checkout-abc"));
            assertTrue(result.output().contains("listening on :8080"));
            verify(session).close();
        }

        @Test
        @DisplayName("missing rollout exits with 1 without opening a session")
        void missingRelease() {
            LogStreamEngine engine = mock(LogStreamEngine.class);
            when(engine.open(any(StreamSubscription.class))).thenThrow(new ReleaseNotFoundException(RELEASE));

            CliResult result = execute(engine, mock(HealthCheckService.class), "tail", "shop/checkout");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("not found"));
        }

        @Test
        @DisplayName("unknown --type exits with 2")
        void badType() {
            CliResult result = execute("tail", "shop/checkout", "--type", "cronjob");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Unknown source type"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("exits with 0 when everything is up")
        void healthy() {
            HealthCheckService healthService = mock(HealthCheckService.class);
            when(healthService.checkAll()).thenReturn(List.of(
                    HealthStatus.clusterReachable("v1.30.2"),
                    HealthStatus.streams(0)));

            CliResult result = execute(mock(LogStreamEngine.class), healthService, "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("v1.30.2"));
        }

        @Test
        @DisplayName("exits with 1 when the cluster is down")
        void clusterDown() {
            HealthCheckService healthService = mock(HealthCheckService.class);
            when(healthService.checkAll()).thenReturn(List.of(
                    HealthStatus.clusterUnreachable("Cluster error: timeout"),
                    HealthStatus.streams(0)));

            CliResult result = execute(mock(LogStreamEngine.class), healthService, "health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Cluster error: timeout"));
        }
    }
}
