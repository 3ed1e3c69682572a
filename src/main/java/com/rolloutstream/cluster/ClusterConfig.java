package com.rolloutstream.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rolloutstream.core.logs.LogStreamProperties;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClusterConfig {

    private static final Logger log = LoggerFactory.getLogger(ClusterConfig.class);

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient(LogStreamProperties properties) {
        String context = properties.getClusterContext();
        Config config = context == null || context.isBlank()
                ? Config.autoConfigure(null)
                : Config.autoConfigure(context);
        config.setRequestTimeout((int) properties.getClusterRequestTimeout().toMillis());
        log.info("Using Kubernetes API server {} (context: {})", config.getMasterUrl(),
                context == null || context.isBlank() ? "current" : context);
        return new KubernetesClientBuilder().withConfig(config).build();
    }

    @Bean
    public ClusterGateway clusterGateway(KubernetesClient kubernetesClient, ObjectMapper objectMapper) {
        return new Fabric8ClusterGateway(kubernetesClient, objectMapper);
    }

    @Bean
    public ReleaseMetadataSource releaseMetadataSource(KubernetesClient kubernetesClient, ObjectMapper objectMapper) {
        return new Fabric8ReleaseMetadataSource(kubernetesClient, objectMapper);
    }
}
