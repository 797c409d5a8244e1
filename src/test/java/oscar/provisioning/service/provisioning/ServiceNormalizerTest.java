package oscar.provisioning.service.provisioning;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.Map;
import oscar.provisioning.config.OscarProperties;
import oscar.provisioning.dto.service.MinioProvider;
import oscar.provisioning.dto.service.ServiceDefinition;
import oscar.provisioning.dto.service.StorageProviders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ServiceNormalizerTest {

    @Mock
    private AccessTokenGenerator tokenGenerator;

    private OscarProperties properties;
    private ServiceNormalizer normalizer;

    @BeforeEach
    void setUp() {
        properties = new OscarProperties();
        properties.getMinio().setEndpoint("http://minio.minio:9000");
        properties.getMinio().setAccessKey("platform-key");
        properties.getMinio().setSecretKey("platform-secret");
        normalizer = new ServiceNormalizer(properties, tokenGenerator);
        when(tokenGenerator.generate()).thenReturn("generated-token");
    }

    private static ServiceDefinition service(String name) {
        ServiceDefinition service = new ServiceDefinition();
        service.setName(name);
        service.setImage("ghcr.io/example/plants:latest");
        return service;
    }

    @Nested
    @DisplayName("Defaults")
    class DefaultsTests {

        @Test
        @DisplayName("Should fill memory, cpu and log level when absent")
        void shouldFillDefaults() {
            ServiceDefinition service = service("plants");

            normalizer.normalize(service);

            assertThat(service.getMemory()).isEqualTo("256Mi");
            assertThat(service.getCpu()).isEqualTo("0.2");
            assertThat(service.getLogLevel()).isEqualTo("INFO");
        }

        @Test
        @DisplayName("Should keep caller supplied resources")
        void shouldKeepCallerResources() {
            ServiceDefinition service = service("plants");
            service.setMemory("1Gi");
            service.setCpu("2");

            normalizer.normalize(service);

            assertThat(service.getMemory()).isEqualTo("1Gi");
            assertThat(service.getCpu()).isEqualTo("2");
        }

        @Test
        @DisplayName("Should uppercase a known log level")
        void shouldUppercaseLogLevel() {
            ServiceDefinition service = service("plants");
            service.setLogLevel("debug");

            normalizer.normalize(service);

            assertThat(service.getLogLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("Should replace an unknown log level with the default")
        void shouldReplaceUnknownLogLevel() {
            ServiceDefinition service = service("plants");
            service.setLogLevel("verbose");

            normalizer.normalize(service);

            assertThat(service.getLogLevel()).isEqualTo("INFO");
        }
    }

    @Nested
    @DisplayName("Labels")
    class LabelsTests {

        @Test
        @DisplayName("Should add the reserved labels and keep caller labels")
        void shouldAddReservedLabels() {
            ServiceDefinition service = service("plants");
            service.setLabels(new HashMap<>(Map.of("team", "imaging")));

            normalizer.normalize(service);

            assertThat(service.getLabels())
                .containsEntry("team", "imaging")
                .containsEntry("oscar_service", "plants")
                .containsEntry("applicationId", "plants")
                .containsEntry("queue", "root.oscar-queue.plants")
                .doesNotContainKey("vo");
            assertThat(service.getAnnotations()).isEmpty();
        }

        @Test
        @DisplayName("Should add the vo label when a VO is set")
        void shouldAddVoLabel() {
            ServiceDefinition service = service("plants");
            service.setVo("vo.example.eu");

            normalizer.normalize(service);

            assertThat(service.getLabels()).containsEntry("vo", "vo.example.eu");
        }
    }

    @Nested
    @DisplayName("Storage providers and token")
    class ProvidersTests {

        @Test
        @DisplayName("Should inject the platform MinIO as the default provider")
        void shouldInjectDefaultMinio() {
            ServiceDefinition service = service("plants");

            normalizer.normalize(service);

            MinioProvider minio = service.getStorageProviders().getMinio().get(StorageProviders.DEFAULT_PROVIDER);
            assertThat(minio.getEndpoint()).isEqualTo("http://minio.minio:9000");
            assertThat(minio.getAccessKey()).isEqualTo("platform-key");
        }

        @Test
        @DisplayName("Should overwrite a caller supplied default provider")
        void shouldOverwriteCallerDefault() {
            ServiceDefinition service = service("plants");
            StorageProviders providers = new StorageProviders();
            providers.getMinio().put("default", MinioProvider.builder()
                .endpoint("http://attacker:9000").accessKey("x").secretKey("y").build());
            providers.getMinio().put("other", MinioProvider.builder().endpoint("http://other:9000").build());
            service.setStorageProviders(providers);

            normalizer.normalize(service);

            assertThat(service.getStorageProviders().getMinio().get("default").getEndpoint())
                .isEqualTo("http://minio.minio:9000");
            assertThat(service.getStorageProviders().getMinio()).containsKey("other");
        }

        @Test
        @DisplayName("Should assign a freshly generated access token")
        void shouldAssignToken() {
            ServiceDefinition service = service("plants");
            service.setToken("caller-token");

            normalizer.normalize(service);

            assertThat(service.getToken()).isEqualTo("generated-token");
        }
    }
}
