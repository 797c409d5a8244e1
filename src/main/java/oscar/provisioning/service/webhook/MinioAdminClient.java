package oscar.provisioning.service.webhook;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import oscar.provisioning.dto.service.MinioProvider;
import oscar.provisioning.exception.StorageAdminException;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.signer.Aws4Signer;
import software.amazon.awssdk.auth.signer.params.Aws4SignerParams;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.regions.Region;

/**
 * MinIO admin API client (v3) for webhook target registration.
 * Requests are SigV4 signed with the platform's MinIO credentials.
 */
@Slf4j
public class MinioAdminClient implements StorageAdminClient {

    static final String SET_CONFIG_PATH = "/minio/admin/v3/set-config-kv";
    static final String SERVICE_PATH = "/minio/admin/v3/service";
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

    private final OkHttpClient client;
    private final AdminPayloadCipher cipher;
    private final MinioProvider minio;
    private final String serviceEndpoint;

    public MinioAdminClient(OkHttpClient client, AdminPayloadCipher cipher, MinioProvider minio,
                            String serviceEndpoint) {
        this.client = client;
        this.cipher = cipher;
        this.minio = minio;
        this.serviceEndpoint = serviceEndpoint.endsWith("/")
            ? serviceEndpoint.substring(0, serviceEndpoint.length() - 1)
            : serviceEndpoint;
    }

    @Override
    public void registerWebhook(String serviceName, String token) throws StorageAdminException {
        String config = String.format("notify_webhook:%s endpoint=%s/job/%s auth_token=%s",
            serviceName, serviceEndpoint, serviceName, token);
        byte[] body;
        try {
            body = cipher.encrypt(minio.getSecretKey(), config.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new StorageAdminException("set-config-kv", "unable to encrypt webhook configuration", e);
        }
        execute("set-config-kv", SdkHttpMethod.PUT, SET_CONFIG_PATH, Map.of(), body);
        log.info("Registered MinIO webhook target for service {}", serviceName);
    }

    @Override
    public void restartServer() throws StorageAdminException {
        execute("restart", SdkHttpMethod.POST, SERVICE_PATH, Map.of("action", "restart"), new byte[0]);
        log.info("MinIO server restart requested");
    }

    private void execute(String operation, SdkHttpMethod method, String path, Map<String, String> query,
                         byte[] body) throws StorageAdminException {
        HttpUrl base = HttpUrl.parse(minio.getEndpoint());
        if (base == null) {
            throw new StorageAdminException(operation, "invalid MinIO endpoint: " + minio.getEndpoint());
        }
        HttpUrl.Builder urlBuilder = base.newBuilder().encodedPath(path);
        query.forEach(urlBuilder::addQueryParameter);
        HttpUrl url = urlBuilder.build();

        Request.Builder request = new Request.Builder()
            .url(url)
            .method(method.name(), method == SdkHttpMethod.GET ? null : RequestBody.create(body, OCTET_STREAM));
        signedHeaders(method, url, path, query, body).forEach(request::header);

        try (Response response = client.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                String detail = response.body() != null ? response.body().string() : "";
                throw new StorageAdminException(operation,
                    String.format("MinIO admin %s failed with status %d: %s", operation, response.code(), detail));
            }
        } catch (IOException e) {
            throw new StorageAdminException(operation, "MinIO admin " + operation + " failed: " + e.getMessage(), e);
        }
    }

    private Map<String, String> signedHeaders(SdkHttpMethod method, HttpUrl url, String path,
                                              Map<String, String> query, byte[] body) {
        SdkHttpFullRequest.Builder request = SdkHttpFullRequest.builder()
            .method(method)
            .protocol(url.scheme())
            .host(url.host())
            .port(url.port())
            .encodedPath(path)
            .putHeader("x-amz-content-sha256", sha256Hex(body))
            .contentStreamProvider(() -> new ByteArrayInputStream(body));
        query.forEach(request::putRawQueryParameter);

        String region = minio.getRegion() != null ? minio.getRegion() : MinioProvider.DEFAULT_REGION;
        Aws4SignerParams params = Aws4SignerParams.builder()
            .awsCredentials(AwsBasicCredentials.create(minio.getAccessKey(), minio.getSecretKey()))
            .signingName("s3")
            .signingRegion(Region.of(region))
            .build();
        SdkHttpFullRequest signed = Aws4Signer.create().sign(request.build(), params);

        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> header : signed.headers().entrySet()) {
            // OkHttp derives Host from the URL, identical to what was signed
            if (!"Host".equalsIgnoreCase(header.getKey()) && !header.getValue().isEmpty()) {
                headers.put(header.getKey(), header.getValue().get(0));
            }
        }
        return headers;
    }

    private static String sha256Hex(byte[] body) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
