package oscar.provisioning.dto.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OnedataProvider {

    @JsonProperty("oneprovider_host")
    private String oneproviderHost;

    @ToString.Exclude
    private String token;

    private String space;
}
