package com.rolloutstream.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the log engine's value types.
 */
class ModelTest {

    @Nested
    @DisplayName("ReleaseRef")
    class ReleaseRefTests {

        @Test
        @DisplayName("parses namespace/name")
        void parsesNamespaceAndName() {
            var ref = ReleaseRef.parse("shop/checkout");
            assertEquals("shop", ref.namespace());
            assertEquals("checkout", ref.name());
            assertEquals("shop/checkout", ref.id());
            assertEquals("shop/checkout", ref.toString());
        }

        @Test
        @DisplayName("rejects values without exactly one separator")
        void rejectsMalformedValues() {
            assertThrows(IllegalArgumentException.class, () -> ReleaseRef.parse("checkout"));
            assertThrows(IllegalArgumentException.class, () -> ReleaseRef.parse("/checkout"));
            assertThrows(IllegalArgumentException.class, () -> ReleaseRef.parse("shop/"));
            assertThrows(IllegalArgumentException.class, () -> ReleaseRef.parse("a/b/c"));
            assertThrows(IllegalArgumentException.class, () -> ReleaseRef.parse(null));
        }
    }

    @Nested
    @DisplayName("SourceType and SourceFilter")
    class SourceTypeTests {

        @Test
        @DisplayName("resolves wire names and their older aliases")
        void resolvesWireNames() {
            assertEquals(SourceType.WORKLOAD, SourceType.fromWireName("workload"));
            assertEquals(SourceType.WORKLOAD, SourceType.fromWireName("pod"));
            assertEquals(SourceType.JOB, SourceType.fromWireName(" JOB "));
            assertEquals(SourceType.JOB, SourceType.fromWireName("test"));
        }

        @Test
        @DisplayName("rejects unknown types")
        void rejectsUnknownTypes() {
            assertThrows(IllegalArgumentException.class, () -> SourceType.fromWireName("daemonset"));
            assertThrows(IllegalArgumentException.class, () -> SourceFilter.parse("bogus"));
        }

        @Test
        @DisplayName("blank filter admits every type")
        void blankFilterAdmitsAll() {
            var filter = SourceFilter.parse("  ");
            assertSame(SourceFilter.ALL, filter);
            assertTrue(filter.admits(SourceType.WORKLOAD));
            assertTrue(filter.admits(SourceType.JOB));
            assertTrue(filter.restriction().isEmpty());
        }

        @Test
        @DisplayName("restricted filter admits only its type")
        void restrictedFilter() {
            var filter = SourceFilter.parse("job");
            assertFalse(filter.admits(SourceType.WORKLOAD));
            assertTrue(filter.admits(SourceType.JOB));
            assertEquals(SourceType.JOB, filter.restriction().orElseThrow());
        }

        @Test
        @DisplayName("subscription without filter follows every type")
        void subscriptionDefaultsToAll() {
            var subscription = new StreamSubscription(ReleaseRef.parse("ns/app"), null, null);
            assertSame(SourceFilter.ALL, subscription.filter());
        }
    }

    @Nested
    @DisplayName("LabelSelector")
    class LabelSelectorTests {

        @Test
        @DisplayName("matches when every label is present with the same value")
        void matchesSubset() {
            var selector = new LabelSelector(Map.of("app", "web", "tier", "front"));
            assertTrue(selector.matches(Map.of("app", "web", "tier", "front", "extra", "x")));
            assertFalse(selector.matches(Map.of("app", "web")));
            assertFalse(selector.matches(Map.of("app", "api", "tier", "front")));
            assertFalse(selector.matches(null));
        }

        @Test
        @DisplayName("empty selector matches nothing")
        void emptyMatchesNothing() {
            assertTrue(LabelSelector.EMPTY.isEmpty());
            assertFalse(LabelSelector.EMPTY.matches(Map.of("app", "web")));
        }

        @Test
        @DisplayName("renders labels sorted by key")
        void rendersSorted() {
            var selector = new LabelSelector(Map.of("b", "2", "a", "1"));
            assertEquals("a=1,b=2", selector.toSelectorString());
        }
    }

    @Nested
    @DisplayName("Target")
    class TargetTests {

        @Test
        @DisplayName("workload target is keyed by ReplicaSet and selects by pod-template-hash")
        void workloadTarget() {
            var target = Target.workload("shop", "web-7d9f", "7d9f");
            assertEquals("rs/shop/web-7d9f", target.id());
            assertEquals("pod-template-hash=7d9f", target.selector().toSelectorString());
            assertEquals(SourceType.WORKLOAD, target.kind());
            assertFalse(target.isSinglePod());
        }

        @Test
        @DisplayName("job target selects by job name")
        void jobTarget() {
            var target = Target.job("shop", "smoke-1");
            assertEquals("job/shop/smoke-1", target.id());
            assertEquals("batch.kubernetes.io/job-name=smoke-1", target.selector().toSelectorString());
            assertEquals(SourceType.JOB, target.kind());
        }

        @Test
        @DisplayName("single pod target carries the pod name and container")
        void podTarget() {
            var target = Target.pod("shop", "web-abc", "app", null);
            assertEquals("pod/shop/web-abc", target.id());
            assertTrue(target.isSinglePod());
            assertEquals("app", target.containerHint());
            assertEquals(SourceType.WORKLOAD, target.kind());
        }
    }

    @Nested
    @DisplayName("Descriptor and ManagedResource")
    class DescriptorTests {

        @Test
        @DisplayName("expands both substitution syntaxes")
        void expandsSubstitutions() {
            var descriptor = new Descriptor("flux", "app", Map.of("VERSION", "1.4.2"));
            assertEquals("registry/app:1.4.2", descriptor.substitute("registry/app:${VERSION}"));
            assertEquals("v-1.4.2", descriptor.substitute("v-$(VERSION)"));
            assertEquals("${OTHER}", descriptor.substitute("${OTHER}"));
            assertNull(descriptor.substitute(null));
        }

        @Test
        @DisplayName("derives the group from the apiVersion")
        void derivesGroup() {
            var node = JsonNodeFactory.instance.objectNode();
            var deployment = new ManagedResource("apps/v1", "Deployment", "ns", "web", node);
            var configMap = new ManagedResource("v1", "ConfigMap", "ns", "cfg", node);
            assertTrue(deployment.isKind("apps", "Deployment"));
            assertFalse(deployment.isKind("", "Deployment"));
            assertTrue(configMap.isKind("", "ConfigMap"));
        }

        @Test
        @DisplayName("is absent when the live object could not be fetched")
        void absentWithoutObject() {
            assertFalse(new ManagedResource("apps/v1", "Deployment", "ns", "web", null).isPresent());
            assertTrue(new ManagedResource("apps/v1", "Deployment", "ns", "web",
                    JsonNodeFactory.instance.objectNode()).isPresent());
        }
    }

    @Nested
    @DisplayName("LogEvent")
    class LogEventTests {

        @Test
        @DisplayName("serializes with the field names clients read")
        void serializesWireFields() throws Exception {
            var event = new LogEvent("web-1", "app", SourceType.JOB, "hello", 1_700_000_000_000L);
            var json = new ObjectMapper().readTree(new ObjectMapper().writeValueAsString(event));

            assertEquals("web-1", json.get("pod").asText());
            assertEquals("app", json.get("container").asText());
            assertEquals("job", json.get("type").asText());
            assertEquals("hello", json.get("line").asText());
            assertEquals(1_700_000_000_000L, json.get("timestamp").asLong());
            assertFalse(json.has("streamKey"));
        }

        @Test
        @DisplayName("exposes its stream key")
        void streamKey() {
            var event = new LogEvent("web-1", "app", SourceType.WORKLOAD, "x", 0);
            assertEquals(new StreamKey("web-1", "app"), event.streamKey());
            assertEquals("web-1/app", event.streamKey().toString());
        }

        @Test
        @DisplayName("cluster pod copies its container lists")
        void clusterPodCopies() {
            var pod = new ClusterPod("p", "ns", null, null, List.of("app"));
            assertEquals(Map.of(), pod.labels());
            assertEquals(List.of(), pod.initContainers());
            assertEquals(List.of("app"), pod.containers());
        }
    }
}
