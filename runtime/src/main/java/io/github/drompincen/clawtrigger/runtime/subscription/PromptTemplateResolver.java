package io.github.drompincen.clawtrigger.runtime.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expands {@code {{name}}} placeholders. Built-ins are {@code date}, {@code time}, {@code datetime},
 * {@code timestamp} and {@code subscription_name}; subscription variables and per-firing variables
 * follow, later ones winning. Maps and lists are written as JSON, unknown placeholders stay as is.
 */
@Component
public class PromptTemplateResolver {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PromptTemplateResolver(ObjectMapper objectMapper) {
        this(objectMapper, Clock.systemDefaultZone());
    }

    PromptTemplateResolver(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String resolve(SubscriptionDocument subscription, Map<String, ?> extraVariables) {
        String template = subscription.getPromptTemplate();
        if (template == null || template.isEmpty()) {
            return "";
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("date", DATE.format(now));
        variables.put("time", TIME.format(now));
        variables.put("datetime", DATETIME.format(now));
        variables.put("timestamp", String.valueOf(clock.instant().getEpochSecond()));
        variables.put("subscription_name", subscription.getName() != null ? subscription.getName() : "");
        if (subscription.getPromptVariables() != null) {
            variables.putAll(subscription.getPromptVariables());
        }
        if (extraVariables != null) {
            variables.putAll(extraVariables);
        }

        String result = template;
        for (Map.Entry<String, Object> entry : variables.entrySet()) {
            String placeholder = "{{" + entry.getKey() + "}}";
            if (result.contains(placeholder)) {
                result = result.replace(placeholder, render(entry.getValue()));
            }
        }
        return result;
    }

    private String render(Object value) {
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }
}
