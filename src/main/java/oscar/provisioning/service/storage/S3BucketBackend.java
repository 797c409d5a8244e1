package oscar.provisioning.service.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import oscar.provisioning.exception.ProvisioningException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Event;
import software.amazon.awssdk.services.s3.model.FilterRule;
import software.amazon.awssdk.services.s3.model.FilterRuleName;
import software.amazon.awssdk.services.s3.model.GetBucketNotificationConfigurationResponse;
import software.amazon.awssdk.services.s3.model.NotificationConfiguration;
import software.amazon.awssdk.services.s3.model.NotificationConfigurationFilter;
import software.amazon.awssdk.services.s3.model.QueueConfiguration;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3KeyFilter;

/**
 * Bucket provisioning for MinIO and Amazon S3 providers through the S3 API.
 * Notification entries are kept as the ordered list the server returned; entries of other
 * services are written back unchanged, with or without an id.
 */
@Slf4j
public class S3BucketBackend implements StorageBackend {

    private static final Set<String> BUCKET_EXISTS_CODES = Set.of("BucketAlreadyOwnedByYou", "BucketAlreadyExists");

    private final ProviderKind kind;
    private final String providerId;
    private final S3Client client;

    public S3BucketBackend(ProviderKind kind, String providerId, S3Client client) {
        this.kind = kind;
        this.providerId = providerId;
        this.client = client;
    }

    @Override
    public ProviderKind kind() {
        return kind;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public void createBucketOrContainer(StoragePath path) {
        String bucket = path.bucket();
        try {
            client.createBucket(b -> b.bucket(bucket));
            log.info("Created bucket \"{}\" in {}.{}", bucket, kind.getWireName(), providerId);
        } catch (S3Exception e) {
            if (!BUCKET_EXISTS_CODES.contains(errorCode(e))) {
                throw failure(String.format("error creating bucket %s: %s", bucket, e.getMessage()), e);
            }
            log.info("The bucket \"{}\" already exists", bucket);
        } catch (SdkException e) {
            throw failure(String.format("error creating bucket %s: %s", bucket, e.getMessage()), e);
        }

        if (path.hasFolder()) {
            // Zero-byte key ending in "/" materializes the folder; rewriting it is harmless
            try {
                client.putObject(b -> b.bucket(bucket).key(path.folderKey()), RequestBody.empty());
            } catch (SdkException e) {
                throw failure(String.format("error creating folder \"%s\" in bucket \"%s\": %s",
                    path.folderKey(), bucket, e.getMessage()), e);
            }
        }
    }

    @Override
    public void enableNotification(StoragePath path, String arn) {
        String bucket = path.bucket();
        NotificationConfiguration configuration = readNotifications(bucket);

        String prefix = path.folderKey();
        boolean present = configuration.queueConfigurations().stream()
            .anyMatch(existing -> arn.equals(existing.queueArn()) && Objects.equals(prefixOf(existing), prefix));
        if (present) {
            log.info("Bucket \"{}\" already notifies {} for prefix {}", bucket, arn, prefix);
            return;
        }

        QueueConfiguration.Builder queue = QueueConfiguration.builder()
            .queueArn(arn)
            .events(Event.S3_OBJECT_CREATED);
        if (prefix != null) {
            queue.filter(NotificationConfigurationFilter.builder()
                .key(S3KeyFilter.builder()
                    .filterRules(FilterRule.builder().name(FilterRuleName.PREFIX).value(prefix).build())
                    .build())
                .build());
        }
        List<QueueConfiguration> queues = new ArrayList<>(configuration.queueConfigurations());
        queues.add(queue.build());

        writeNotifications(bucket, configuration.toBuilder().queueConfigurations(queues).build(),
            "error enabling bucket notification: ");
    }

    @Override
    public void disableNotification(StoragePath path, String arn) {
        String bucket = path.bucket();
        NotificationConfiguration configuration = readNotifications(bucket);
        List<QueueConfiguration> remaining = configuration.queueConfigurations().stream()
            .filter(queue -> !arn.equals(queue.queueArn()))
            .toList();
        if (remaining.size() == configuration.queueConfigurations().size()) {
            return;
        }
        writeNotifications(bucket, configuration.toBuilder().queueConfigurations(remaining).build(),
            "error disabling bucket notification: ");
    }

    @Override
    public void close() {
        client.close();
    }

    private NotificationConfiguration readNotifications(String bucket) {
        try {
            GetBucketNotificationConfigurationResponse response =
                client.getBucketNotificationConfiguration(b -> b.bucket(bucket));
            return NotificationConfiguration.builder()
                .queueConfigurations(response.queueConfigurations())
                .topicConfigurations(response.topicConfigurations())
                .lambdaFunctionConfigurations(response.lambdaFunctionConfigurations())
                .eventBridgeConfiguration(response.eventBridgeConfiguration())
                .build();
        } catch (SdkException e) {
            throw failure(String.format("error getting bucket \"%s\" notifications: %s", bucket, e.getMessage()), e);
        }
    }

    private void writeNotifications(String bucket, NotificationConfiguration configuration, String errorPrefix) {
        try {
            client.putBucketNotificationConfiguration(b -> b.bucket(bucket).notificationConfiguration(configuration));
        } catch (SdkException e) {
            throw failure(errorPrefix + e.getMessage(), e);
        }
    }

    private ProvisioningException failure(String message, SdkException cause) {
        String code = cause instanceof AwsServiceException service ? errorCode(service) : null;
        String detail = code != null ? " (" + code + ")" : "";
        return ProvisioningException.storageBackend(kind.getWireName(), providerId, message + detail, cause);
    }

    private static String errorCode(AwsServiceException e) {
        return e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
    }

    private static String prefixOf(QueueConfiguration queue) {
        if (queue.filter() == null || queue.filter().key() == null) {
            return null;
        }
        for (FilterRule rule : queue.filter().key().filterRules()) {
            if (FilterRuleName.PREFIX.toString().equalsIgnoreCase(rule.nameAsString())) {
                return rule.value();
            }
        }
        return null;
    }
}
