package com.rolloutstream.dispatch.cli;

import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ReleaseNotFoundException;
import com.rolloutstream.core.logs.LogStreamEngine;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.SourceFilter;
import com.rolloutstream.core.model.Target;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: rollout-stream targets &lt;namespace/name&gt;
 * <p>
 * Prints the workload revisions and test jobs the rollout currently resolves to.
 */
@Command(name = "targets", mixinStandardHelpOptions = true, description = "Show the log targets of a rollout")
@Component
public class TargetsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Rollout as namespace/name")
    private String release;

    @Option(names = {"--type", "-t"}, description = "Only this source type: workload or job")
    private String type;

    private final LogStreamEngine logStreamEngine;

    public TargetsCommand(LogStreamEngine logStreamEngine) {
        this.logStreamEngine = logStreamEngine;
    }

    @Override
    public Integer call() {
        ReleaseRef ref;
        SourceFilter filter;
        try {
            ref = ReleaseRef.parse(release);
            filter = SourceFilter.parse(type);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        List<Target> targets;
        try {
            targets = logStreamEngine.resolveTargets(ref, filter);
        } catch (ReleaseNotFoundException | ClusterAccessException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (targets.isEmpty()) {
            ConsoleOutput.info("No log targets for " + ref);
            return 0;
        }
        ConsoleOutput.info(targets.size() + " log target(s) for " + ref);
        for (Target target : targets) {
            ConsoleOutput.target(target);
        }
        return 0;
    }
}
