package oscar.provisioning.service.webhook;

import java.security.SecureRandom;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.dto.service.MinioProvider;
import org.springframework.stereotype.Component;

/**
 * Builds admin clients bound to the platform's service endpoint and a MinIO deployment.
 */
@Component
@RequiredArgsConstructor
public class MinioAdminClientFactory {

    private final OkHttpClient okHttpClient;
    private final SecureRandom secureRandom;
    private final OscarProperties properties;

    /**
     * @throws IllegalArgumentException if the MinIO configuration lacks an endpoint or credentials
     */
    public StorageAdminClient create(MinioProvider minio) {
        if (minio == null || isBlank(minio.getEndpoint()) || isBlank(minio.getAccessKey())
            || isBlank(minio.getSecretKey())) {
            throw new IllegalArgumentException("MinIO endpoint and credentials are required");
        }
        return new MinioAdminClient(okHttpClient, new AdminPayloadCipher(secureRandom), minio,
            properties.getServiceEndpoint());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
