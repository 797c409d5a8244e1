package oscar.provisioning.service.queue;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.dto.service.ServiceDefinition;
import oscar.provisioning.service.provisioning.ServiceLabels;
import oscar.provisioning.util.LogSanitizer;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Adds a queue per service to the YuniKorn scheduler configuration stored in a ConfigMap:
 * {@code partitions[default].queues[root].queues[<platform>-queue].queues[<service>]}.
 */
@Component
@Slf4j
public class YunikornQueueRegistrar implements SchedulingQueueRegistrar {

    static final String DEFAULT_PARTITION = "default";

    private final KubernetesClient client;
    private final OscarProperties properties;

    public YunikornQueueRegistrar(KubernetesClient client, OscarProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public void registerQueue(ServiceDefinition service) throws QueueRegistrationException {
        OscarProperties.Yunikorn yunikorn = properties.getYunikorn();
        try {
            ConfigMap configMap = client.configMaps()
                .inNamespace(yunikorn.getNamespace())
                .withName(yunikorn.getConfigMap())
                .get();
            if (configMap == null) {
                throw new QueueRegistrationException("the YuniKorn ConfigMap \"" + yunikorn.getConfigMap()
                    + "\" does not exist in namespace \"" + yunikorn.getNamespace() + "\"");
            }

            Map<String, String> data = configMap.getData() != null ? new HashMap<>(configMap.getData())
                : new HashMap<>();
            data.put(yunikorn.getConfigFile(), addServiceQueue(data.get(yunikorn.getConfigFile()), service));
            configMap.setData(data);

            client.configMaps().inNamespace(yunikorn.getNamespace()).resource(configMap).update();
        } catch (KubernetesClientException e) {
            throw new QueueRegistrationException("error updating the YuniKorn configuration: " + e.getMessage(), e);
        } catch (YAMLException | ClassCastException e) {
            throw new QueueRegistrationException("the YuniKorn configuration is not valid: " + e.getMessage(), e);
        }
        log.info("Registered scheduling queue {}",
            LogSanitizer.sanitize(ServiceLabels.queuePath(properties.getName(), service.getName())));
    }

    /**
     * Returns the scheduler configuration with the service's queue added, replacing any previous
     * queue with the same name.
     */
    String addServiceQueue(String rawConfig, ServiceDefinition service) {
        Yaml yaml = new Yaml(dumperOptions());
        Map<String, Object> config = rawConfig != null ? yaml.load(rawConfig) : null;
        if (config == null) {
            config = new LinkedHashMap<>();
        }

        Map<String, Object> partition = findOrAdd(children(config, "partitions"), DEFAULT_PARTITION);
        Map<String, Object> root = findOrAdd(children(partition, "queues"), ServiceLabels.ROOT_QUEUE);
        Map<String, Object> platform = findOrAdd(children(root, "queues"),
            ServiceLabels.platformQueue(properties.getName()));
        List<Map<String, Object>> serviceQueues = children(platform, "queues");
        serviceQueues.removeIf(queue -> service.getName().equals(queue.get("name")));
        serviceQueues.add(serviceQueue(service));

        return yaml.dump(config);
    }

    private static Map<String, Object> serviceQueue(ServiceDefinition service) {
        Map<String, Object> max = new LinkedHashMap<>();
        max.put("memory", service.getMemory());
        max.put("vcore", service.getCpu());

        Map<String, Object> queue = new LinkedHashMap<>();
        queue.put("name", service.getName());
        queue.put("resources", new LinkedHashMap<>(Map.of("max", max)));
        return queue;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> children(Map<String, Object> parent, String key) {
        Object value = parent.get(key);
        if (value == null) {
            List<Map<String, Object>> created = new ArrayList<>();
            parent.put(key, created);
            return created;
        }
        return (List<Map<String, Object>>) value;
    }

    private static Map<String, Object> findOrAdd(List<Map<String, Object>> entries, String name) {
        for (Map<String, Object> entry : entries) {
            if (name.equals(entry.get("name"))) {
                return entry;
            }
        }
        Map<String, Object> created = new LinkedHashMap<>();
        created.put("name", name);
        entries.add(created);
        return created;
    }

    private static DumperOptions dumperOptions() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return options;
    }
}
