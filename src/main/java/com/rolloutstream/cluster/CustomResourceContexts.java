package com.rolloutstream.cluster;

import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

/**
 * Custom resources read through the generic client.
 */
public final class CustomResourceContexts {

    public static final ResourceDefinitionContext ROLLOUT_CONTEXT = new ResourceDefinitionContext.Builder()
            .withGroup("kuberik.com")
            .withVersion("v1alpha1")
            .withKind("Rollout")
            .withPlural("rollouts")
            .withNamespaced(true)
            .build();

    public static final ResourceDefinitionContext KUSTOMIZATION_CONTEXT = new ResourceDefinitionContext.Builder()
            .withGroup("kustomize.toolkit.fluxcd.io")
            .withVersion("v1")
            .withKind("Kustomization")
            .withPlural("kustomizations")
            .withNamespaced(true)
            .build();

    public static final ResourceDefinitionContext OCI_REPOSITORY_CONTEXT = new ResourceDefinitionContext.Builder()
            .withGroup("source.toolkit.fluxcd.io")
            .withVersion("v1beta2")
            .withKind("OCIRepository")
            .withPlural("ocirepositories")
            .withNamespaced(true)
            .build();

    private CustomResourceContexts() {
    }
}
