package oscar.provisioning.dto.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MinioProvider {

    public static final String DEFAULT_REGION = "us-east-1";

    private String endpoint;

    @Builder.Default
    private boolean verify = true;

    @JsonProperty("access_key")
    private String accessKey;

    @ToString.Exclude
    @JsonProperty("secret_key")
    private String secretKey;

    @Builder.Default
    private String region = DEFAULT_REGION;

    /**
     * Trust boundary check: the platform only delivers triggers from its own object store, so
     * a provider is accepted when it names exactly the same endpoint with the same credentials.
     * Region and TLS verification are connection details, not identity.
     */
    public boolean hasSameIdentityAs(MinioProvider other) {
        if (other == null) {
            return false;
        }
        return Objects.equals(endpoint, other.endpoint)
            && Objects.equals(accessKey, other.accessKey)
            && Objects.equals(secretKey, other.secretKey);
    }
}
