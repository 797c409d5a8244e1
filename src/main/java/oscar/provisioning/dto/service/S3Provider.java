package oscar.provisioning.dto.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/** Amazon S3 credentials; the endpoint is derived from the region. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class S3Provider {

    @JsonProperty("access_key")
    private String accessKey;

    @ToString.Exclude
    @JsonProperty("secret_key")
    private String secretKey;

    private String region;
}
