package oscar.provisioning.service.storage;

/**
 * WebDAV (dCache) bindings are read and written by the workload itself; nothing to provision.
 */
public class WebdavBackend implements StorageBackend {

    private final String providerId;

    public WebdavBackend(String providerId) {
        this.providerId = providerId;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.WEBDAV;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public void createBucketOrContainer(StoragePath path) {
        // pull-based
    }
}
