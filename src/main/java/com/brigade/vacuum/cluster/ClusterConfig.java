package com.brigade.vacuum.cluster;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClusterConfig {

    /**
     * Client configured from the usual sources: KUBECONFIG / ~/.kube/config,
     * or the service account when running inside a Pod.
     */
    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        return new KubernetesClientBuilder().build();
    }

    @Bean
    public ClusterAccessorFactory clusterAccessorFactory(KubernetesClient kubernetesClient) {
        return namespace -> new KubernetesClusterAccessor(kubernetesClient, namespace);
    }
}
