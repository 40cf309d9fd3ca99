package com.brigade.vacuum.cluster;

import com.brigade.vacuum.core.model.BuildRecord;
import com.brigade.vacuum.core.model.BuildWorker;
import com.brigade.vacuum.core.model.WorkerPhase;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodList;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Kubernetes-backed ClusterAccessor.
 * Brigade stores one Secret per build (the record) and runs each job in a Pod (the worker);
 * both carry the {@code build} label.
 */
public class KubernetesClusterAccessor implements ClusterAccessor {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClusterAccessor.class);

    private final KubernetesClient client;
    private final String namespace;

    public KubernetesClusterAccessor(KubernetesClient client, String namespace) {
        this.client = client;
        this.namespace = namespace;
    }

    @Override
    public List<BuildRecord> listRecords(LabelSelector selector) {
        try {
            SecretList secrets = selector.isEverything()
                    ? client.secrets().inNamespace(namespace).list()
                    : client.secrets().inNamespace(namespace).withLabels(selector.labels()).list();
            log.debug("Listed {} secrets in {} (selector: '{}')",
                    secrets.getItems().size(), namespace, selector);
            return secrets.getItems().stream().map(KubernetesClusterAccessor::toRecord).toList();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException(
                    "Failed to list secrets in namespace " + namespace + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<BuildWorker> listWorkers(LabelSelector selector) {
        try {
            PodList pods = selector.isEverything()
                    ? client.pods().inNamespace(namespace).list()
                    : client.pods().inNamespace(namespace).withLabels(selector.labels()).list();
            log.debug("Listed {} pods in {} (selector: '{}')",
                    pods.getItems().size(), namespace, selector);
            return pods.getItems().stream().map(KubernetesClusterAccessor::toWorker).toList();
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException(
                    "Failed to list pods in namespace " + namespace + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteRecord(String name) {
        try {
            if (client.secrets().inNamespace(namespace).withName(name).withGracePeriod(0).delete().isEmpty()) {
                log.debug("Secret {} already gone from {}", name, namespace);
            }
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to delete secret " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteWorker(String name) {
        try {
            if (client.pods().inNamespace(namespace).withName(name).withGracePeriod(0).delete().isEmpty()) {
                log.debug("Pod {} already gone from {}", name, namespace);
            }
        } catch (KubernetesClientException e) {
            throw new ClusterAccessException("Failed to delete pod " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String namespace() {
        return namespace;
    }

    static BuildRecord toRecord(Secret secret) {
        ObjectMeta meta = secret.getMetadata();
        return new BuildRecord(meta.getName(), parseTimestamp(meta), labelsOf(meta));
    }

    static BuildWorker toWorker(Pod pod) {
        ObjectMeta meta = pod.getMetadata();
        String phase = pod.getStatus() != null ? pod.getStatus().getPhase() : null;
        return new BuildWorker(meta.getName(), labelsOf(meta), WorkerPhase.fromString(phase));
    }

    private static Map<String, String> labelsOf(ObjectMeta meta) {
        return meta.getLabels() != null ? meta.getLabels() : Map.of();
    }

    /**
     * Kubernetes always stamps creation time; a missing or malformed value sorts as oldest.
     */
    private static Instant parseTimestamp(ObjectMeta meta) {
        String ts = meta.getCreationTimestamp();
        if (ts == null || ts.isBlank()) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(ts);
        } catch (DateTimeParseException e) {
            log.warn("Secret {} has malformed creationTimestamp '{}', treating as epoch", meta.getName(), ts);
            return Instant.EPOCH;
        }
    }
}
