package oscar.provisioning.config;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import java.security.SecureRandom;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.logging.HttpLoggingInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound clients shared by the provisioning components.
 */
@Configuration
public class ClientConfig {

    /** Request and response lines of outbound calls, visible when the application logs at DEBUG. */
    private static final Logger HTTP_LOG = LoggerFactory.getLogger("oscar.provisioning.http");

    @Bean
    public OkHttpClient okHttpClient() {
        return okHttpClient(HTTP_LOG::debug);
    }

    static OkHttpClient okHttpClient(HttpLoggingInterceptor.Logger httpLogger) {
        HttpLoggingInterceptor logging = new HttpLoggingInterceptor(httpLogger)
            .setLevel(HttpLoggingInterceptor.Level.BASIC);
        logging.redactHeader("Authorization");
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ofSeconds(30))
            .writeTimeout(Duration.ofSeconds(30))
            .addInterceptor(logging)
            .build();
    }

    @Bean
    public RestTemplate oidcRestTemplate(RestTemplateBuilder builder) {
        return builder
            .setConnectTimeout(Duration.ofSeconds(10))
            .setReadTimeout(Duration.ofSeconds(30))
            .build();
    }

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        return new KubernetesClientBuilder().build();
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }
}
