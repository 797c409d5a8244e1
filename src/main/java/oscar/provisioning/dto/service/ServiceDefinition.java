package oscar.provisioning.dto.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Declarative definition of a service as received from the API.
 * The normalizer mutates it in place before it travels through the provisioning steps.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceDefinition {

    // Kubernetes object names: lowercase RFC 1123 labels
    @NotBlank
    @Pattern(regexp = "[a-z0-9]([-a-z0-9]*[a-z0-9])?", message = "must be a valid DNS-1123 label")
    private String name;

    private String image;

    private String script;

    private String memory;

    private String cpu;

    @JsonProperty("log_level")
    private String logLevel;

    private String vo;

    private Map<String, String> environment;

    private Map<String, String> labels;

    private Map<String, String> annotations;

    @Valid
    private List<StorageIOConfig> input = new ArrayList<>();

    @Valid
    private List<StorageIOConfig> output = new ArrayList<>();

    @Valid
    @JsonProperty("storage_providers")
    private StorageProviders storageProviders;

    /** Shared secret between the webhook registration and trigger validation. */
    @ToString.Exclude
    private String token;

    /**
     * ARN of the notification target that MinIO uses to deliver events for this service.
     */
    public String minioWebhookArn() {
        MinioProvider defaultProvider = storageProviders != null
            ? storageProviders.getMinio().get(StorageProviders.DEFAULT_PROVIDER)
            : null;
        String region = defaultProvider != null && defaultProvider.getRegion() != null
            ? defaultProvider.getRegion()
            : MinioProvider.DEFAULT_REGION;
        return String.format("arn:minio:sqs:%s:%s:webhook", region, name);
    }
}
