package io.github.drompincen.clawtrigger.runtime.scheduler.xxljob;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * JSON-over-HTTP calls to XXL-JOB admin servers. Addresses are tried in order and the first reply
 * with {@code code == 200} wins.
 */
public class XxlJobAdminClient {

    private static final Logger log = LoggerFactory.getLogger(XxlJobAdminClient.class);

    public static final String ACCESS_TOKEN_HEADER = "XXL-JOB-ACCESS-TOKEN";
    public static final String API_REGISTRY = "/api/registry";
    public static final String API_REGISTRY_REMOVE = "/api/registryRemove";
    public static final String API_CALLBACK = "/api/callback";
    public static final String API_JOB_ADD = "/jobinfo/add";
    public static final String API_JOB_UPDATE = "/jobinfo/update";
    public static final String API_JOB_REMOVE = "/jobinfo/remove";
    public static final String API_JOB_START = "/jobinfo/start";
    public static final String API_JOB_STOP = "/jobinfo/stop";
    public static final String API_JOB_TRIGGER = "/jobinfo/trigger";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final List<String> adminAddresses;
    private final String accessToken;
    private final Duration timeout;

    public XxlJobAdminClient(HttpClient httpClient, ObjectMapper objectMapper, List<String> adminAddresses,
                             String accessToken, Duration timeout) {
        if (adminAddresses == null || adminAddresses.isEmpty()) {
            throw new IllegalArgumentException("At least one XXL-JOB admin address is required");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.adminAddresses = List.copyOf(adminAddresses);
        this.accessToken = accessToken;
        this.timeout = timeout;
    }

    public List<String> adminAddresses() {
        return adminAddresses;
    }

    public String accessToken() {
        return accessToken;
    }

    /**
     * @throws XxlJobAdminException when every admin address failed or answered with an error code
     */
    public JsonNode post(String endpoint, Object body) {
        String lastError = null;
        for (String address : adminAddresses) {
            try {
                return postTo(address, endpoint, body);
            } catch (XxlJobAdminException e) {
                log.warn("XXL-JOB admin {} rejected {}: {}", address, endpoint, e.getMessage());
                lastError = e.getMessage();
            }
        }
        throw new XxlJobAdminException("All XXL-JOB admin addresses failed for " + endpoint + ": " + lastError);
    }

    public JsonNode postTo(String address, String endpoint, Object body) {
        String url = stripTrailingSlash(address) + endpoint;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
            if (accessToken != null && !accessToken.isBlank()) {
                builder.header(ACCESS_TOKEN_HEADER, accessToken);
            }
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            JsonNode result = objectMapper.readTree(response.body());
            if (result == null || result.path("code").asInt() != 200) {
                String msg = result != null ? result.path("msg").asText("Unknown error") : "Empty response";
                throw new XxlJobAdminException(msg + " (HTTP " + response.statusCode() + ")");
            }
            return result;
        } catch (IOException e) {
            throw new XxlJobAdminException("Request to " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new XxlJobAdminException("Interrupted calling " + url, e);
        } catch (IllegalArgumentException e) {
            throw new XxlJobAdminException("Invalid admin URL " + url, e);
        }
    }

    private static String stripTrailingSlash(String address) {
        return address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
    }
}
