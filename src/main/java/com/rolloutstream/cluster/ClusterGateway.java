package com.rolloutstream.cluster;

import com.rolloutstream.core.model.ClusterPod;
import com.rolloutstream.core.model.Descriptor;
import com.rolloutstream.core.model.LabelSelector;
import com.rolloutstream.core.model.ManagedResource;
import com.rolloutstream.core.model.ReleaseRef;
import com.rolloutstream.core.model.WorkloadGeneration;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the cluster API used by the log engine.
 * Implementations: Fabric8ClusterGateway.
 * <p>
 * Every method may throw {@link ClusterAccessException}.
 */
public interface ClusterGateway {

    /**
     * Lists the pods in a namespace matching a selector.
     */
    List<ClusterPod> getPods(String namespace, LabelSelector selector);

    /**
     * Looks up a single pod by name.
     */
    Optional<ClusterPod> getPod(String namespace, String name);

    /**
     * Follows one container's log with timestamps. The caller owns the returned stream.
     */
    LogStream streamContainerLogs(String namespace, String pod, String container, LogStreamOptions options);

    /**
     * Finds the deployment descriptors (Flux Kustomizations) whose output depends on the release.
     */
    List<Descriptor> getDescriptorsForRelease(ReleaseRef release);

    /**
     * Returns the objects recorded in a descriptor's inventory.
     */
    List<ManagedResource> getManagedResourcesForDescriptor(Descriptor descriptor);

    /**
     * Lists workload generations (ReplicaSets) in a namespace.
     */
    List<WorkloadGeneration> getWorkloadGenerations(String namespace);

    /**
     * Performs a cheap round trip to the API server.
     *
     * @return the server version
     */
    String checkConnectivity();
}
