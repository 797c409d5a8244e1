package oscar.provisioning.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import oscar.provisioning.dto.service.MinioProvider;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "oscar")
public class OscarProperties {

    /** Platform name, also used to name the scheduling queue that groups its services. */
    private String name = "oscar";

    /** Namespace where the platform itself runs. */
    private String namespace = "oscar";

    /** Namespace where service workloads are created. */
    private String servicesNamespace = "oscar-svc";

    /** Public base URL of this platform; MinIO delivers events to {@code <serviceEndpoint>/job/<service>}. */
    private String serviceEndpoint = "http://oscar.oscar:8080";

    /** Basic auth credentials for the API. */
    private String username = "oscar";
    private String password;

    private Minio minio = new Minio();
    private Oidc oidc = new Oidc();
    private Yunikorn yunikorn = new Yunikorn();
    private Defaults defaults = new Defaults();

    @Data
    public static class Minio {
        private String endpoint = "http://minio.minio:9000";
        private String region = MinioProvider.DEFAULT_REGION;
        private String accessKey = "minio";
        private String secretKey;
        private boolean verify = true;

        /** Provider entry for id {@code default}; a fresh copy on every call. */
        public MinioProvider toProvider() {
            return MinioProvider.builder()
                .endpoint(endpoint)
                .region(region)
                .accessKey(accessKey)
                .secretKey(secretKey)
                .verify(verify)
                .build();
        }
    }

    @Data
    public static class Oidc {
        private boolean enabled = false;
        private String issuer = "https://aai.egi.eu/auth/realms/egi";
        /** Subject granted access regardless of group membership. */
        private String subject;
        /** Groups whose members are granted access. */
        private List<String> groups = new ArrayList<>();
        private String groupUrnPrefix = "urn:mace:egi.eu:group";
        /** Minimum spacing between two token cache sweeps; zero sweeps on every insertion. */
        private Duration sweepMinInterval = Duration.ZERO;
    }

    @Data
    public static class Yunikorn {
        private boolean enabled = false;
        private String namespace = "yunikorn";
        private String configMap = "yunikorn-configs";
        private String configFile = "queues.yaml";
    }

    @Data
    public static class Defaults {
        private String memory = "256Mi";
        private String cpu = "0.2";
        private String logLevel = "INFO";
    }
}
