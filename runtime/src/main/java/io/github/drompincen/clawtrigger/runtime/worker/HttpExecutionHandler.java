package io.github.drompincen.clawtrigger.runtime.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class HttpExecutionHandler implements ExecutionHandler {

    private static final Logger log = LoggerFactory.getLogger(HttpExecutionHandler.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;

    @Autowired
    public HttpExecutionHandler(ObjectMapper objectMapper,
                                @Value("${clawtrigger.agent.endpoint:http://localhost:8081/api/agent/execute}") String endpoint) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper, URI.create(endpoint));
    }

    HttpExecutionHandler(HttpClient httpClient, ObjectMapper objectMapper, URI endpoint) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
    }

    @Override
    public ExecutionOutcome execute(ExecutionContext context) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("executionId", context.executionId());
        body.put("subscriptionId", context.subscriptionId());
        body.put("userId", context.userId());
        body.put("prompt", context.prompt());
        body.put("retryAttempt", context.retryAttempt());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(context.timeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        log.debug("Posting execution {} to {}", context.executionId(), endpoint);
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new ExecutionHandlerException("Agent endpoint returned HTTP " + response.statusCode()
                    + ": " + abbreviate(response.body()));
        }

        JsonNode json = objectMapper.readTree(response.body());
        String summary = json.path("summary").isMissingNode() || json.path("summary").isNull()
                ? null : json.path("summary").asText();
        boolean silent = json.path("silent").asBoolean(false);
        long taskId = json.path("taskId").asLong(0);
        ExecutionOutcome outcome = silent ? ExecutionOutcome.silent(summary) : ExecutionOutcome.completed(summary);
        return outcome.withTaskId(taskId);
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }
}
