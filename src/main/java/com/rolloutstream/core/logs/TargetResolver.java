package com.rolloutstream.core.logs;

import com.fasterxml.jackson.databind.JsonNode;
import com.rolloutstream.cluster.ClusterAccessException;
import com.rolloutstream.cluster.ClusterGateway;
import com.rolloutstream.cluster.ReleaseMetadataSource;
import com.rolloutstream.core.metrics.LogStreamMetrics;
import com.rolloutstream.core.model.Descriptor;
import com.rolloutstream.core.model.LabelSelector;
import com.rolloutstream.core.model.ManagedResource;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.SourceFilter;
import com.rolloutstream.core.model.SourceType;
import com.rolloutstream.core.model.Target;
import com.rolloutstream.core.model.WorkloadGeneration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks from a release to the concrete pod groups to tail.
 *
 * <p>Resolution path:
 * <ul>
 *   <li>release -> descriptors (Flux Kustomizations associated with the rollout)</li>
 *   <li>descriptor -> inventory of managed resources</li>
 *   <li>Deployment -> the ReplicaSet generations matching the wanted revision, each
 *       selected by its {@code pod-template-hash}</li>
 *   <li>Job or RolloutTest -> the job's pods by {@code batch.kubernetes.io/job-name}</li>
 * </ul>
 *
 * <p>Descriptors are resolved independently. A descriptor that fails is logged and
 * skipped, so partial results are normal while a release is changing.
 */
public class TargetResolver {

    private static final Logger log = LoggerFactory.getLogger(TargetResolver.class);

    static final String POD_TEMPLATE_HASH = "pod-template-hash";

    private final ClusterGateway gateway;
    private final ReleaseMetadataSource releaseMetadata;
    private final LogStreamMetrics metrics;

    public TargetResolver(ClusterGateway gateway, ReleaseMetadataSource releaseMetadata, LogStreamMetrics metrics) {
        this.gateway = gateway;
        this.releaseMetadata = releaseMetadata;
        this.metrics = metrics;
    }

    /**
     * Resolves the targets of a release.
     *
     * @throws com.rolloutstream.cluster.ReleaseNotFoundException if the release does not exist
     * @throws ClusterAccessException if the release or its descriptors cannot be read
     */
    public List<Target> resolve(ReleaseRef release, SourceFilter filter) {
        long start = System.currentTimeMillis();
        Optional<String> revision = releaseMetadata.wantedRevision(release);
        List<Descriptor> descriptors = gateway.getDescriptorsForRelease(release);
        log.debug("Resolving {} descriptors for release {} (revision: {})",
                descriptors.size(), release, revision.orElse("<none>"));

        Map<String, Target> targets = new LinkedHashMap<>();
        Map<String, List<WorkloadGeneration>> generationsByNamespace = new HashMap<>();
        for (Descriptor descriptor : descriptors) {
            try {
                for (Target target : resolveDescriptor(descriptor, revision.orElse(null), filter, generationsByNamespace)) {
                    targets.putIfAbsent(target.id(), target);
                }
            } catch (ClusterAccessException e) {
                log.warn("Skipping descriptor {} of release {}: {}", descriptor, release, e.getMessage());
                if (metrics != null) {
                    metrics.recordDiscoveryFailure("descriptor");
                }
            }
        }

        if (metrics != null) {
            metrics.recordResolution(System.currentTimeMillis() - start, targets.size());
        }
        log.debug("Release {} resolved to {} targets", release, targets.size());
        return new ArrayList<>(targets.values());
    }

    private List<Target> resolveDescriptor(Descriptor descriptor, String revision, SourceFilter filter,
                                           Map<String, List<WorkloadGeneration>> generationsByNamespace) {
        var targets = new ArrayList<Target>();
        for (ManagedResource resource : gateway.getManagedResourcesForDescriptor(descriptor)) {
            if (!resource.isPresent()) {
                continue;
            }
            if (filter.admits(SourceType.WORKLOAD) && resource.isKind("apps", "Deployment")) {
                List<WorkloadGeneration> generations = generationsByNamespace.computeIfAbsent(
                        resource.namespace(), gateway::getWorkloadGenerations);
                targets.addAll(workloadTargets(resource, generations, descriptor, revision));
            } else if (filter.admits(SourceType.JOB)) {
                jobTarget(resource).ifPresent(targets::add);
            }
        }
        return targets;
    }

    static List<Target> workloadTargets(ManagedResource deployment, List<WorkloadGeneration> generations,
                                        Descriptor descriptor, String revision) {
        LabelSelector deploymentSelector = matchLabels(deployment.object().path("spec").path("selector"));
        var targets = new ArrayList<Target>();
        for (WorkloadGeneration generation : generations) {
            boolean owned = generation.isOwnedBy("Deployment", deployment.name())
                    || deploymentSelector.matches(generation.labels());
            if (!owned) {
                continue;
            }
            if (revision != null && !matchesRevision(generation, descriptor, revision)) {
                log.trace("Generation {} does not carry revision {}", generation.name(), revision);
                continue;
            }
            String hash = generation.labels().get(POD_TEMPLATE_HASH);
            if (hash == null || hash.isBlank()) {
                continue;
            }
            targets.add(Target.workload(generation.namespace(), generation.name(), hash));
        }
        return targets;
    }

    /**
     * Substring match of the revision token against label and annotation keys and values and
     * container images, after expanding the descriptor's substitution variables.
     */
    static boolean matchesRevision(WorkloadGeneration generation, Descriptor descriptor, String revision) {
        for (var entry : generation.labels().entrySet()) {
            if (contains(descriptor, entry.getKey(), revision) || contains(descriptor, entry.getValue(), revision)) {
                return true;
            }
        }
        for (var entry : generation.annotations().entrySet()) {
            if (contains(descriptor, entry.getKey(), revision) || contains(descriptor, entry.getValue(), revision)) {
                return true;
            }
        }
        for (String image : generation.images()) {
            if (contains(descriptor, image, revision)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(Descriptor descriptor, String value, String revision) {
        String expanded = descriptor.substitute(value);
        return expanded != null && expanded.contains(revision);
    }

    static Optional<Target> jobTarget(ManagedResource resource) {
        if (resource.isKind("batch", "Job")) {
            return Optional.of(Target.job(resource.namespace(), resource.name()));
        }
        if ("RolloutTest".equals(resource.kind())) {
            String jobName = resource.object().path("status").path("jobName").asText("");
            if (jobName.isBlank()) {
                log.debug("RolloutTest {}/{} has no job yet", resource.namespace(), resource.name());
                return Optional.empty();
            }
            return Optional.of(Target.job(resource.namespace(), jobName));
        }
        return Optional.empty();
    }

    private static LabelSelector matchLabels(JsonNode selector) {
        Map<String, String> labels = new LinkedHashMap<>();
        var fields = selector.path("matchLabels").fields();
        while (fields.hasNext()) {
            var field = fields.next();
            labels.put(field.getKey(), field.getValue().asText());
        }
        return new LabelSelector(labels);
    }
}
