package oscar.provisioning.service.storage;

import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import oscar.provisioning.dto.service.MinioProvider;
import oscar.provisioning.dto.service.OnedataProvider;
import oscar.provisioning.dto.service.S3Provider;
import oscar.provisioning.dto.service.StorageProviders;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link StorageBackend} for a provider instance declared by a service.
 */
@Component
@RequiredArgsConstructor
public class StorageBackendFactory {

    private final S3ClientFactory s3ClientFactory;
    private final OkHttpClient okHttpClient;

    /**
     * @throws IllegalArgumentException if {@code id} is not declared for {@code kind}
     */
    public StorageBackend create(ProviderKind kind, String id, StorageProviders providers) {
        Object config = kind.instances(providers).get(id);
        if (config == null) {
            throw new IllegalArgumentException("Provider " + kind.getWireName() + "." + id + " is not declared");
        }
        return switch (kind) {
            case MINIO -> new S3BucketBackend(kind, id, s3ClientFactory.forMinio((MinioProvider) config));
            case S3 -> new S3BucketBackend(kind, id, s3ClientFactory.forS3((S3Provider) config));
            case ONEDATA -> {
                OnedataProvider onedata = (OnedataProvider) config;
                yield new OnedataContainerBackend(id,
                    new CdmiClient(okHttpClient, onedata.getOneproviderHost(), onedata.getToken()),
                    onedata.getSpace(), onedata.getOneproviderHost());
            }
            case WEBDAV -> new WebdavBackend(id);
        };
    }
}
