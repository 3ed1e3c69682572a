package com.rolloutstream.core.logs;

import com.rolloutstream.cluster.ClusterGateway;
import com.rolloutstream.core.model.ClusterPod;
import com.rolloutstream.core.model.LabelSelector;
import com.rolloutstream.core.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Lists the pods currently matching a target's selector. No retries: a failure
 * surfaces as {@link com.rolloutstream.cluster.ClusterAccessException} and the
 * calling supervisor tries again on its next tick.
 */
public class PodEnumerator {

    private static final Logger log = LoggerFactory.getLogger(PodEnumerator.class);

    private final ClusterGateway gateway;

    public PodEnumerator(ClusterGateway gateway) {
        this.gateway = gateway;
    }

    /** Pods of a target: the named pod if it still exists, otherwise the selector's matches. */
    public List<ClusterPod> enumerate(Target target) {
        if (target.isSinglePod()) {
            return gateway.getPod(target.namespace(), target.podName()).map(List::of).orElse(List.of());
        }
        return enumerate(target.namespace(), target.selector());
    }

    public List<ClusterPod> enumerate(String namespace, LabelSelector selector) {
        if (selector.isEmpty()) {
            return List.of();
        }
        List<ClusterPod> pods = gateway.getPods(namespace, selector);
        log.debug("Selector {} in {} matched {} pods", selector, namespace, pods.size());
        return pods;
    }
}
