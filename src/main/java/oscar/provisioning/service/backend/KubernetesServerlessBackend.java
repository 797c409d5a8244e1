package oscar.provisioning.service.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.PodTemplate;
import io.fabric8.kubernetes.api.model.PodTemplateBuilder;
import io.fabric8.kubernetes.api.model.Quantity;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.net.HttpURLConnection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.dto.service.ServiceDefinition;
import oscar.provisioning.exception.ServiceAlreadyExistsException;
import oscar.provisioning.exception.WorkloadBackendException;
import oscar.provisioning.util.LogSanitizer;
import org.springframework.stereotype.Component;

/**
 * Stores each service as a ConfigMap holding its definition and script, plus a PodTemplate that
 * jobs are spawned from when an event arrives.
 */
@Component
@Slf4j
public class KubernetesServerlessBackend implements ServerlessBackend {

    public static final String SERVICE_FILE = "function_config.yaml";
    public static final String SCRIPT_FILE = "script.sh";
    static final String CONTAINER_NAME = "oscar-container";

    private final KubernetesClient client;
    private final OscarProperties properties;
    private final ObjectMapper objectMapper;

    public KubernetesServerlessBackend(KubernetesClient client, OscarProperties properties,
                                       ObjectMapper objectMapper) {
        this.client = client;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void createWorkload(ServiceDefinition service) throws WorkloadBackendException {
        String namespace = properties.getServicesNamespace();
        ConfigMap configMap = buildConfigMap(service);
        try {
            client.configMaps().inNamespace(namespace).resource(configMap).create();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                throw new ServiceAlreadyExistsException(e);
            }
            throw new WorkloadBackendException(
                "error creating the service's ConfigMap: " + e.getMessage(), e);
        }

        try {
            client.resources(PodTemplate.class).inNamespace(namespace).resource(buildPodTemplate(service)).create();
        } catch (KubernetesClientException e) {
            deleteConfigMapQuietly(namespace, service.getName());
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                throw new ServiceAlreadyExistsException(e);
            }
            throw new WorkloadBackendException(
                "error creating the service's PodTemplate: " + e.getMessage(), e);
        }
        log.info("Created workload objects for service {} in namespace {}",
            LogSanitizer.sanitize(service.getName()), namespace);
    }

    @Override
    public void deleteWorkload(String name) throws WorkloadBackendException {
        String namespace = properties.getServicesNamespace();
        try {
            client.resources(PodTemplate.class).inNamespace(namespace).withName(name).delete();
            client.configMaps().inNamespace(namespace).withName(name).delete();
        } catch (KubernetesClientException e) {
            throw new WorkloadBackendException("error deleting the service: " + e.getMessage(), e);
        }
        log.info("Deleted workload objects for service {}", LogSanitizer.sanitize(name));
    }

    ConfigMap buildConfigMap(ServiceDefinition service) throws WorkloadBackendException {
        String definition;
        try {
            definition = objectMapper.writeValueAsString(service);
        } catch (JsonProcessingException e) {
            throw new WorkloadBackendException("unable to serialize the service", e);
        }
        Map<String, String> data = new HashMap<>();
        data.put(SERVICE_FILE, definition);
        data.put(SCRIPT_FILE, service.getScript() != null ? service.getScript() : "");

        return new ConfigMapBuilder()
            .withNewMetadata()
                .withName(service.getName())
                .withNamespace(properties.getServicesNamespace())
                .withLabels(service.getLabels())
            .endMetadata()
            .withData(data)
            .build();
    }

    PodTemplate buildPodTemplate(ServiceDefinition service) {
        Map<String, Quantity> limits = new HashMap<>();
        if (service.getMemory() != null) {
            limits.put("memory", new Quantity(service.getMemory()));
        }
        if (service.getCpu() != null) {
            limits.put("cpu", new Quantity(service.getCpu()));
        }

        return new PodTemplateBuilder()
            .withNewMetadata()
                .withName(service.getName())
                .withNamespace(properties.getServicesNamespace())
                .withLabels(service.getLabels())
                .withAnnotations(service.getAnnotations())
            .endMetadata()
            .withNewTemplate()
                .withNewMetadata()
                    .withLabels(service.getLabels())
                    .withAnnotations(service.getAnnotations())
                .endMetadata()
                .withNewSpec()
                    .addNewContainer()
                        .withName(CONTAINER_NAME)
                        .withImage(service.getImage())
                        .withEnv(environment(service))
                        .withNewResources()
                            .withLimits(limits)
                        .endResources()
                    .endContainer()
                    .withRestartPolicy("Never")
                .endSpec()
            .endTemplate()
            .build();
    }

    private static List<EnvVar> environment(ServiceDefinition service) {
        if (service.getEnvironment() == null) {
            return List.of();
        }
        return service.getEnvironment().entrySet().stream()
            .map(e -> new EnvVarBuilder().withName(e.getKey()).withValue(e.getValue()).build())
            .toList();
    }

    private void deleteConfigMapQuietly(String namespace, String name) {
        try {
            client.configMaps().inNamespace(namespace).withName(name).delete();
        } catch (KubernetesClientException e) {
            log.warn("Unable to delete ConfigMap {} after a failed creation: {}",
                LogSanitizer.sanitize(name), e.getMessage());
        }
    }
}
