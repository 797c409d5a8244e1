package oscar.provisioning.service.storage;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import oscar.provisioning.dto.service.StorageProviders;

/**
 * Storage backend families a service can bind to.
 */
public enum ProviderKind {
    MINIO("minio", true) {
        @Override
        public Map<String, ?> instances(StorageProviders providers) {
            return providers.getMinio();
        }
    },
    S3("s3", false) {
        @Override
        public Map<String, ?> instances(StorageProviders providers) {
            return providers.getS3();
        }
    },
    ONEDATA("onedata", false) {
        @Override
        public Map<String, ?> instances(StorageProviders providers) {
            return providers.getOnedata();
        }
    },
    // Pulled by the workload at invocation time; no provisioning on either side
    WEBDAV("webdav", true) {
        @Override
        public Map<String, ?> instances(StorageProviders providers) {
            return providers.getWebdav();
        }
    };

    private final String wireName;
    private final boolean inputCapable;

    ProviderKind(String wireName, boolean inputCapable) {
        this.wireName = wireName;
        this.inputCapable = inputCapable;
    }

    /** Provider instances of this kind declared by a service, keyed by id. */
    public abstract Map<String, ?> instances(StorageProviders providers);

    public String getWireName() {
        return wireName;
    }

    public boolean isInputCapable() {
        return inputCapable;
    }

    public static Optional<ProviderKind> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(kind -> kind.wireName.equals(normalized)).findFirst();
    }
}
