package oscar.provisioning.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ClientConfigTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should hand request and response lines of outbound calls to the application logger")
    void shouldLogOutboundCalls() throws Exception {
        List<String> lines = new CopyOnWriteArrayList<>();
        OkHttpClient client = ClientConfig.okHttpClient(lines::add);
        server.enqueue(new MockResponse().setResponseCode(204));

        try (Response response = client.newCall(new Request.Builder()
                .url(server.url("/cdmi/space/"))
                .header("Authorization", "Bearer secret-token")
                .build()).execute()) {
            assertThat(response.code()).isEqualTo(204);
        }

        assertThat(lines).anySatisfy(line -> assertThat(line).startsWith("--> GET").contains("/cdmi/space/"));
        assertThat(lines).anySatisfy(line -> assertThat(line).startsWith("<-- 204"));
        assertThat(lines).noneSatisfy(line -> assertThat(line).contains("secret-token"));
    }
}
