package oscar.provisioning.service.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import oscar.provisioning.exception.CdmiBadRequestException;
import oscar.provisioning.exception.CdmiException;

/**
 * Minimal CDMI client for Onedata's Oneprovider: container creation only.
 */
@Slf4j
public class CdmiClient {

    static final String SPECIFICATION_VERSION = "1.1.1";
    private static final MediaType CONTAINER_TYPE = MediaType.get("application/cdmi-container");

    private final OkHttpClient client;
    private final HttpUrl baseUrl;
    private final String token;

    public CdmiClient(OkHttpClient client, String oneproviderHost, String token) {
        this.client = client;
        this.baseUrl = baseUrl(oneproviderHost);
        this.token = token;
    }

    /**
     * Creates the container at {@code path}; with {@code createParents}, every ancestor is created first.
     *
     * @throws CdmiBadRequestException if the server answers 400, usually because the container exists
     * @throws CdmiException on any other error response or connectivity failure
     */
    public void createContainer(String path, boolean createParents) throws CdmiException {
        List<String> segments = segments(path);
        if (segments.isEmpty()) {
            throw new CdmiBadRequestException("empty container path");
        }
        if (createParents) {
            for (int i = 1; i < segments.size(); i++) {
                try {
                    put(segments.subList(0, i));
                } catch (CdmiBadRequestException e) {
                    log.debug("Parent container {} not created: {}", String.join("/", segments.subList(0, i)),
                        e.getMessage());
                }
            }
        }
        put(segments);
    }

    private void put(List<String> segments) throws CdmiException {
        HttpUrl.Builder url = baseUrl.newBuilder().addPathSegment("cdmi");
        segments.forEach(url::addPathSegment);
        // Trailing slash marks a container
        url.addPathSegment("");

        Request request = new Request.Builder()
            .url(url.build())
            .header("X-Auth-Token", token)
            .header("X-CDMI-Specification-Version", SPECIFICATION_VERSION)
            .put(RequestBody.create(new byte[0], CONTAINER_TYPE))
            .build();

        try (Response response = client.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return;
            }
            String message = String.format("CDMI PUT %s answered %d", url.build().encodedPath(), response.code());
            if (response.code() == 400) {
                throw new CdmiBadRequestException(message);
            }
            throw new CdmiException(message);
        } catch (IOException e) {
            throw new CdmiException("CDMI request to " + baseUrl.host() + " failed: " + e.getMessage(), e);
        }
    }

    private static List<String> segments(String path) {
        List<String> segments = new ArrayList<>();
        for (String segment : path.split("/")) {
            if (!segment.isBlank()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    private static HttpUrl baseUrl(String host) {
        String url = host.startsWith("http://") || host.startsWith("https://") ? host : "https://" + host;
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Oneprovider host: " + host);
        }
        return parsed;
    }
}
