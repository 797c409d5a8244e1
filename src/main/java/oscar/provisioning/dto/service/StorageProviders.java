package oscar.provisioning.dto.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Storage provider instances declared by a service, keyed by provider id per kind.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageProviders {

    /** Reserved id, always bound to the platform's own MinIO deployment. */
    public static final String DEFAULT_PROVIDER = "default";

    @JsonProperty("minio")
    private Map<String, MinioProvider> minio = new LinkedHashMap<>();

    @JsonProperty("s3")
    private Map<String, S3Provider> s3 = new LinkedHashMap<>();

    @JsonProperty("onedata")
    private Map<String, OnedataProvider> onedata = new LinkedHashMap<>();

    @JsonProperty("webdav")
    private Map<String, WebdavProvider> webdav = new LinkedHashMap<>();

    public void setMinio(Map<String, MinioProvider> minio) {
        this.minio = minio != null ? new LinkedHashMap<>(minio) : new LinkedHashMap<>();
    }

    public void setS3(Map<String, S3Provider> s3) {
        this.s3 = s3 != null ? new LinkedHashMap<>(s3) : new LinkedHashMap<>();
    }

    public void setOnedata(Map<String, OnedataProvider> onedata) {
        this.onedata = onedata != null ? new LinkedHashMap<>(onedata) : new LinkedHashMap<>();
    }

    public void setWebdav(Map<String, WebdavProvider> webdav) {
        this.webdav = webdav != null ? new LinkedHashMap<>(webdav) : new LinkedHashMap<>();
    }
}
