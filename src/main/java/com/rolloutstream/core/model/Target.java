package com.rolloutstream.core.model;

/**
 * A version-scoped group of pods to tail.
 *
 * @param id            stable identity derived from the underlying revision
 *                      ({@code rs/<ns>/<replicaset>}, {@code job/<ns>/<job>} or {@code pod/<ns>/<pod>})
 * @param namespace     namespace the pods live in
 * @param selector      selector narrowing the pods to this revision
 * @param kind          source type stamped on every log event
 * @param containerHint optional container to restrict tailing to (nullable)
 * @param podName       set for a target that follows one named pod instead of a selector (nullable)
 */
public record Target(
    String id,
    String namespace,
    LabelSelector selector,
    SourceType kind,
    String containerHint,
    String podName
) {

    public static Target workload(String namespace, String replicaSetName, String podTemplateHash) {
        return new Target("rs/" + namespace + "/" + replicaSetName, namespace,
                LabelSelector.of("pod-template-hash", podTemplateHash), SourceType.WORKLOAD, null, null);
    }

    public static Target job(String namespace, String jobName) {
        return new Target("job/" + namespace + "/" + jobName, namespace,
                LabelSelector.of("batch.kubernetes.io/job-name", jobName), SourceType.JOB, null, null);
    }

    public static Target pod(String namespace, String podName, String container, SourceType kind) {
        return new Target("pod/" + namespace + "/" + podName, namespace, LabelSelector.EMPTY,
                kind == null ? SourceType.WORKLOAD : kind, container, podName);
    }

    public boolean isSinglePod() {
        return podName != null;
    }
}
