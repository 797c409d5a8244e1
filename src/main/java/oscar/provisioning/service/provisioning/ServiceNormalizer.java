package oscar.provisioning.service.provisioning;

import java.util.HashMap;
import lombok.RequiredArgsConstructor;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.dto.service.LogLevel;
import oscar.provisioning.dto.service.ServiceDefinition;
import oscar.provisioning.dto.service.StorageProviders;
import org.springframework.stereotype.Component;

/**
 * Applies defaults and platform-owned values to an incoming service definition, in place.
 */
@Component
@RequiredArgsConstructor
public class ServiceNormalizer {

    private final OscarProperties properties;
    private final AccessTokenGenerator tokenGenerator;

    public void normalize(ServiceDefinition service) {
        OscarProperties.Defaults defaults = properties.getDefaults();

        // Resource quantities are validated by the scheduler, not here
        if (isEmpty(service.getMemory())) {
            service.setMemory(defaults.getMemory());
        }
        if (isEmpty(service.getCpu())) {
            service.setCpu(defaults.getCpu());
        }

        LogLevel fallback = LogLevel.parseOrDefault(defaults.getLogLevel(), LogLevel.INFO);
        service.setLogLevel(LogLevel.parseOrDefault(service.getLogLevel(), fallback).name());

        if (service.getLabels() == null) {
            service.setLabels(new HashMap<>());
        }
        service.getLabels().put(ServiceLabels.SERVICE, service.getName());
        service.getLabels().put(ServiceLabels.APPLICATION_ID, service.getName());
        service.getLabels().put(ServiceLabels.QUEUE, ServiceLabels.queuePath(properties.getName(), service.getName()));
        if (!isEmpty(service.getVo())) {
            service.getLabels().put(ServiceLabels.VO, service.getVo());
        }

        if (service.getAnnotations() == null) {
            service.setAnnotations(new HashMap<>());
        }

        // The platform's own object store always supersedes a caller supplied "default" entry
        if (service.getStorageProviders() == null) {
            service.setStorageProviders(new StorageProviders());
        }
        service.getStorageProviders().getMinio()
            .put(StorageProviders.DEFAULT_PROVIDER, properties.getMinio().toProvider());

        service.setToken(tokenGenerator.generate());
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
