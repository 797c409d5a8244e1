package oscar.provisioning.service.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import oscar.provisioning.dto.service.MinioProvider;
import oscar.provisioning.exception.ErrorKind;
import oscar.provisioning.exception.ProvisioningException;
import oscar.provisioning.exception.StorageAdminException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WebhookRegistrarTest {

    @Mock
    private MinioAdminClientFactory adminClientFactory;
    @Mock
    private StorageAdminClient adminClient;

    private final MinioProvider minio = MinioProvider.builder()
        .endpoint("http://minio:9000").accessKey("k").secretKey("s").build();

    private WebhookRegistrar registrar;

    @BeforeEach
    void setUp() {
        registrar = new WebhookRegistrar(adminClientFactory);
    }

    @Test
    @DisplayName("Should register the target and then restart MinIO")
    void shouldRegisterThenRestart() throws Exception {
        when(adminClientFactory.create(minio)).thenReturn(adminClient);

        registrar.register("plants", "service-token", minio);

        InOrder order = inOrder(adminClient);
        order.verify(adminClient).registerWebhook("plants", "service-token");
        order.verify(adminClient).restartServer();
    }

    @Test
    @DisplayName("Should not restart when registration fails")
    void shouldNotRestartAfterFailedRegistration() throws Exception {
        when(adminClientFactory.create(minio)).thenReturn(adminClient);
        doThrow(new StorageAdminException("set-config-kv", "forbidden"))
            .when(adminClient).registerWebhook("plants", "service-token");

        assertThatThrownBy(() -> registrar.register("plants", "service-token", minio))
            .isInstanceOfSatisfying(ProvisioningException.class,
                e -> assertThat(e.getKind()).isEqualTo(ErrorKind.WEBHOOK_REGISTRATION));
        verify(adminClient, never()).restartServer();
    }

    @Test
    @DisplayName("Should fail when the restart fails")
    void shouldFailOnRestartError() throws Exception {
        when(adminClientFactory.create(minio)).thenReturn(adminClient);
        doThrow(new StorageAdminException("restart", "timeout")).when(adminClient).restartServer();

        assertThatThrownBy(() -> registrar.register("plants", "service-token", minio))
            .isInstanceOfSatisfying(ProvisioningException.class, e -> {
                assertThat(e.getKind()).isEqualTo(ErrorKind.WEBHOOK_REGISTRATION);
                assertThat(e.getMessage()).contains("restarting");
            });
    }

    @Test
    @DisplayName("Should fail when the MinIO configuration is incomplete")
    void shouldFailOnInvalidConfiguration() {
        when(adminClientFactory.create(null)).thenThrow(new IllegalArgumentException("MinIO endpoint required"));

        assertThatThrownBy(() -> registrar.register("plants", "service-token", null))
            .isInstanceOfSatisfying(ProvisioningException.class,
                e -> assertThat(e.getKind()).isEqualTo(ErrorKind.WEBHOOK_REGISTRATION));
    }
}
