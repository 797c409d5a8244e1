package oscar.provisioning.service.storage;

import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.exception.CdmiBadRequestException;
import oscar.provisioning.exception.CdmiException;
import oscar.provisioning.exception.ProvisioningException;

/**
 * Creates containers in a Onedata space through CDMI.
 */
@Slf4j
public class OnedataContainerBackend implements StorageBackend {

    private final String providerId;
    private final CdmiClient client;
    private final String space;
    private final String oneproviderHost;

    public OnedataContainerBackend(String providerId, CdmiClient client, String space, String oneproviderHost) {
        this.providerId = providerId;
        this.client = client;
        this.space = space;
        this.oneproviderHost = oneproviderHost;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.ONEDATA;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public void createBucketOrContainer(StoragePath path) {
        String containerPath = space + "/" + path.fullPath();
        try {
            client.createContainer(containerPath, true);
        } catch (CdmiBadRequestException e) {
            log.warn("Error creating \"{}\" folder in Onedata. Error: {}", path.fullPath(), e.getMessage());
        } catch (CdmiException e) {
            throw ProvisioningException.storageBackend(kind().getWireName(), providerId,
                String.format("error connecting to Onedata's Oneprovider \"%s\". Error: %s",
                    oneproviderHost, e.getMessage()), e);
        }
    }
}
