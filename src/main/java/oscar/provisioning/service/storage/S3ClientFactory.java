package oscar.provisioning.service.storage;

import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.dto.service.MinioProvider;
import oscar.provisioning.dto.service.S3Provider;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpConfigurationOption;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.utils.AttributeMap;

/**
 * Builds S3 API clients for MinIO (path-style, explicit endpoint) and Amazon S3 (regional endpoint).
 * Callers own the returned client and must close it.
 */
@Component
@Slf4j
public class S3ClientFactory {

    private static final AttributeMap TRUST_ALL_CERTIFICATES = AttributeMap.builder()
        .put(SdkHttpConfigurationOption.TRUST_ALL_CERTIFICATES, Boolean.TRUE)
        .build();

    public S3Client forMinio(MinioProvider provider) {
        String region = provider.getRegion() != null ? provider.getRegion() : MinioProvider.DEFAULT_REGION;
        S3ClientBuilder builder = S3Client.builder()
            .credentialsProvider(credentials(provider.getAccessKey(), provider.getSecretKey()))
            .region(Region.of(region))
            .endpointOverride(URI.create(provider.getEndpoint()))
            .forcePathStyle(true);
        if (!provider.isVerify()) {
            log.warn("TLS certificate verification disabled for MinIO endpoint {}", provider.getEndpoint());
            // Built by the SDK so that closing the S3 client also closes the HTTP client
            builder.httpClientBuilder(defaults -> ApacheHttpClient.builder()
                .buildWithDefaults(TRUST_ALL_CERTIFICATES.merge(defaults)));
        }
        return builder.build();
    }

    public S3Client forS3(S3Provider provider) {
        String region = provider.getRegion() != null && !provider.getRegion().isBlank()
            ? provider.getRegion()
            : MinioProvider.DEFAULT_REGION;
        return S3Client.builder()
            .credentialsProvider(credentials(provider.getAccessKey(), provider.getSecretKey()))
            .region(Region.of(region))
            .build();
    }

    private static StaticCredentialsProvider credentials(String accessKey, String secretKey) {
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
    }
}
