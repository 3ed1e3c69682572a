package com.rolloutstream.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolloutstream.core.model.ReleaseRef;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.util.Optional;

/**
 * Reads the wanted revision from the kuberik {@code Rollout}: the version tag of the
 * most recent history entry.
 */
public class Fabric8ReleaseMetadataSource implements ReleaseMetadataSource {

    private final KubernetesClient client;
    private final ObjectMapper objectMapper;

    public Fabric8ReleaseMetadataSource(KubernetesClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<String> wantedRevision(ReleaseRef release) {
        GenericKubernetesResource rollout;
        try {
            rollout = client.genericKubernetesResources(CustomResourceContexts.ROLLOUT_CONTEXT)
                    .inNamespace(release.namespace())
                    .withName(release.name())
                    .get();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to get rollout " + release, e);
        }
        if (rollout == null) {
            throw new ReleaseNotFoundException(release);
        }
        return revisionFrom(objectMapper.valueToTree(rollout));
    }

    static Optional<String> revisionFrom(JsonNode rollout) {
        JsonNode history = rollout.path("status").path("history");
        if (!history.isArray() || history.isEmpty()) {
            return Optional.empty();
        }
        String tag = history.get(0).path("version").path("tag").asText("");
        return tag.isBlank() ? Optional.empty() : Optional.of(tag);
    }
}
