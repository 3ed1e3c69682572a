package com.rolloutstream.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolloutstream.core.model.ClusterPod;
import com.rolloutstream.core.model.Descriptor;
import com.rolloutstream.core.model.LabelSelector;
import com.rolloutstream.core.model.ManagedResource;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.WorkloadGeneration;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.apps.ReplicaSet;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.LogWatch;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ClusterGateway} backed by the fabric8 Kubernetes client.
 * <p>
 * Flux and kuberik resources are read through the generic client and handed to
 * the engine as Jackson trees; pods and ReplicaSets use the typed client.
 */
public class Fabric8ClusterGateway implements ClusterGateway {

    private static final Logger log = LoggerFactory.getLogger(Fabric8ClusterGateway.class);

    static final String SUBSTITUTE_ANNOTATION_PREFIX = "rollout.kuberik.com/substitute.";
    static final String SUBSTITUTE_ANNOTATION_SUFFIX = ".from";
    static final String ROLLOUT_ANNOTATION = "rollout.kuberik.com/rollout";

    private final KubernetesClient client;
    private final ObjectMapper objectMapper;

    public Fabric8ClusterGateway(KubernetesClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ClusterPod> getPods(String namespace, LabelSelector selector) {
        try {
            List<Pod> pods = client.pods().inNamespace(namespace)
                    .withLabelSelector(selector.toSelectorString())
                    .list()
                    .getItems();
            return Optional.ofNullable(pods).orElse(List.of()).stream()
                    .map(Fabric8ClusterGateway::toClusterPod)
                    .toList();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to list pods in " + namespace + " for " + selector, e);
        }
    }

    @Override
    public Optional<ClusterPod> getPod(String namespace, String name) {
        try {
            Pod pod = client.pods().inNamespace(namespace).withName(name).get();
            return Optional.ofNullable(pod).map(Fabric8ClusterGateway::toClusterPod);
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to get pod " + namespace + "/" + name, e);
        }
    }

    @Override
    public LogStream streamContainerLogs(String namespace, String pod, String container, LogStreamOptions options) {
        try {
            var containerResource = client.pods().inNamespace(namespace).withName(pod).inContainer(container);
            var loggable = containerResource.usingTimestamps();
            LogWatch watch;
            if (options.sinceTime() != null) {
                watch = loggable.sinceTime(DateTimeFormatter.ISO_INSTANT.format(options.sinceTime())).watchLog();
            } else if (options.tailLimit().isPresent()) {
                watch = loggable.tailingLines(options.tailLimit().getAsInt()).watchLog();
            } else {
                watch = loggable.watchLog();
            }
            return new LogWatchStream(watch);
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to open log stream for " + pod + "/" + container, e);
        }
    }

    @Override
    public List<Descriptor> getDescriptorsForRelease(ReleaseRef release) {
        List<JsonNode> kustomizations;
        Set<String> releaseRepositories = new HashSet<>();
        try {
            kustomizations = listGeneric(release.namespace(), CustomResourceContexts.KUSTOMIZATION_CONTEXT);
            for (JsonNode repository : listGeneric(release.namespace(), CustomResourceContexts.OCI_REPOSITORY_CONTEXT)) {
                JsonNode metadata = repository.path("metadata");
                if (release.name().equals(metadata.path("annotations").path(ROLLOUT_ANNOTATION).asText(null))) {
                    releaseRepositories.add(metadata.path("name").asText());
                }
            }
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to list descriptors for release " + release, e);
        }

        var descriptors = new ArrayList<Descriptor>();
        for (JsonNode kustomization : kustomizations) {
            if (referencesRelease(kustomization, release.name(), releaseRepositories)) {
                descriptors.add(toDescriptor(kustomization));
            }
        }
        log.debug("Release {} has {} descriptors", release, descriptors.size());
        return descriptors;
    }

    static boolean referencesRelease(JsonNode kustomization, String releaseName, Set<String> releaseRepositories) {
        var annotations = kustomization.path("metadata").path("annotations").fields();
        while (annotations.hasNext()) {
            var annotation = annotations.next();
            if (annotation.getKey().startsWith(SUBSTITUTE_ANNOTATION_PREFIX)
                    && annotation.getKey().endsWith(SUBSTITUTE_ANNOTATION_SUFFIX)
                    && releaseName.equals(annotation.getValue().asText())) {
                return true;
            }
        }
        JsonNode sourceRef = kustomization.path("spec").path("sourceRef");
        return "OCIRepository".equals(sourceRef.path("kind").asText())
                && releaseRepositories.contains(sourceRef.path("name").asText());
    }

    static Descriptor toDescriptor(JsonNode kustomization) {
        JsonNode metadata = kustomization.path("metadata");
        Map<String, String> substitutions = new LinkedHashMap<>();
        var substitute = kustomization.path("spec").path("postBuild").path("substitute").fields();
        while (substitute.hasNext()) {
            var entry = substitute.next();
            substitutions.put(entry.getKey(), entry.getValue().asText());
        }
        return new Descriptor(metadata.path("namespace").asText(), metadata.path("name").asText(), substitutions);
    }

    @Override
    public List<ManagedResource> getManagedResourcesForDescriptor(Descriptor descriptor) {
        GenericKubernetesResource kustomization;
        try {
            kustomization = client.genericKubernetesResources(CustomResourceContexts.KUSTOMIZATION_CONTEXT)
                    .inNamespace(descriptor.namespace())
                    .withName(descriptor.name())
                    .get();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to get kustomization " + descriptor, e);
        }
        if (kustomization == null) {
            throw new ClusterAccessException("Kustomization " + descriptor + " no longer exists");
        }

        JsonNode entries = objectMapper.valueToTree(kustomization).path("status").path("inventory").path("entries");
        if (!entries.isArray()) {
            log.debug("Kustomization {} has no inventory", descriptor);
            return List.of();
        }

        var resources = new ArrayList<ManagedResource>();
        for (JsonNode entry : entries) {
            String rawId = entry.path("id").asText();
            var parsed = InventoryEntryId.parse(rawId);
            if (parsed.isEmpty()) {
                log.debug("Skipping unparseable inventory entry {} in {}", rawId, descriptor);
                continue;
            }
            InventoryEntryId id = parsed.get();
            String apiVersion = id.apiVersion(entry.path("v").asText());
            resources.add(new ManagedResource(apiVersion, id.kind(), id.namespace(), id.name(),
                    fetchObject(apiVersion, id)));
        }
        return resources;
    }

    private JsonNode fetchObject(String apiVersion, InventoryEntryId id) {
        try {
            var operation = client.genericKubernetesResources(apiVersion, id.kind());
            GenericKubernetesResource object = id.namespace().isEmpty()
                    ? operation.withName(id.name()).get()
                    : operation.inNamespace(id.namespace()).withName(id.name()).get();
            return object == null ? null : objectMapper.valueToTree(object);
        } catch (KubernetesClientException e) {
            log.debug("Failed to get {} {}/{}: {}", id.kind(), id.namespace(), id.name(), e.getMessage());
            return null;
        }
    }

    @Override
    public List<WorkloadGeneration> getWorkloadGenerations(String namespace) {
        try {
            List<ReplicaSet> replicaSets = client.apps().replicaSets().inNamespace(namespace).list().getItems();
            return Optional.ofNullable(replicaSets).orElse(List.of()).stream()
                    .map(Fabric8ClusterGateway::toGeneration)
                    .toList();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to list ReplicaSets in " + namespace, e);
        }
    }

    @Override
    public String checkConnectivity() {
        try {
            return client.getKubernetesVersion().getGitVersion();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Cluster API unreachable", e);
        }
    }

    private List<JsonNode> listGeneric(String namespace, ResourceDefinitionContext context) {
        List<GenericKubernetesResource> items = client.genericKubernetesResources(context)
                .inNamespace(namespace)
                .list()
                .getItems();
        return Optional.ofNullable(items).orElse(List.of()).stream()
                .map(item -> (JsonNode) objectMapper.valueToTree(item))
                .toList();
    }

    private static ClusterPod toClusterPod(Pod pod) {
        ObjectMeta metadata = pod.getMetadata();
        PodSpec spec = pod.getSpec();
        return new ClusterPod(
                metadata.getName(),
                metadata.getNamespace(),
                metadata.getLabels(),
                spec == null ? List.of() : containerNames(spec.getInitContainers()),
                spec == null ? List.of() : containerNames(spec.getContainers()));
    }

    private static WorkloadGeneration toGeneration(ReplicaSet replicaSet) {
        ObjectMeta metadata = replicaSet.getMetadata();
        List<WorkloadGeneration.OwnerRef> owners = Optional.ofNullable(metadata.getOwnerReferences())
                .orElse(List.of()).stream()
                .map(ref -> new WorkloadGeneration.OwnerRef(ref.getKind(), ref.getName()))
                .toList();
        List<String> images = List.of();
        if (replicaSet.getSpec() != null && replicaSet.getSpec().getTemplate() != null
                && replicaSet.getSpec().getTemplate().getSpec() != null) {
            PodSpec template = replicaSet.getSpec().getTemplate().getSpec();
            images = Optional.ofNullable(template.getContainers()).orElse(List.of()).stream()
                    .map(Container::getImage)
                    .filter(Objects::nonNull)
                    .toList();
        }
        return new WorkloadGeneration(metadata.getName(), metadata.getNamespace(),
                metadata.getLabels(), metadata.getAnnotations(), owners, images);
    }

    private static List<String> containerNames(List<Container> containers) {
        if (containers == null) {
            return List.of();
        }
        return containers.stream()
                .map(Container::getName)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Line reader over a fabric8 {@link LogWatch}.
     */
    private static final class LogWatchStream implements LogStream {

        private final LogWatch watch;
        private final BufferedReader reader;

        LogWatchStream(LogWatch watch) {
            this.watch = watch;
            this.reader = new BufferedReader(new InputStreamReader(watch.getOutput(), StandardCharsets.UTF_8));
        }

        @Override
        public String readLine() throws IOException {
            return reader.readLine();
        }

        @Override
        public void close() {
            watch.close();
            try {
                reader.close();
            } catch (IOException e) {
                log.debug("Error closing log reader: {}", e.getMessage());
            }
        }
    }
}
