package com.rolloutstream.core.logs;

import com.rolloutstream.core.model.PodInfo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Release-wide view of the pods currently being followed, keyed by the target that found them.
 * A pod leaves the roster once no target enumerates it any more.
 */
public class PodRoster {

    private static final Comparator<PodInfo> ORDER = Comparator
            .comparing(PodInfo::type)
            .thenComparing(PodInfo::namespace)
            .thenComparing(PodInfo::name);

    private final Object lock = new Object();
    private final Map<String, List<PodInfo>> podsByTarget = new HashMap<>();

    /**
     * Replaces the pods found by one target.
     *
     * @return {@code true} if the target's pods differ from the previous update
     */
    public boolean update(String targetId, List<PodInfo> pods) {
        List<PodInfo> copy = List.copyOf(pods);
        synchronized (lock) {
            return !copy.equals(podsByTarget.put(targetId, copy));
        }
    }

    public void remove(String targetId) {
        synchronized (lock) {
            podsByTarget.remove(targetId);
        }
    }

    public List<PodInfo> snapshot() {
        Set<PodInfo> distinct = new LinkedHashSet<>();
        synchronized (lock) {
            podsByTarget.values().forEach(distinct::addAll);
        }
        List<PodInfo> result = new ArrayList<>(distinct);
        result.sort(ORDER);
        return result;
    }
}
