package com.signalbot.backend.service.indicator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalbot.backend.exception.InvalidSignalConfigException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses a bot's stored signal configuration into typed indicator configs.
 * <p>
 * Accepts either a JSON array of objects tagged with {@code type}, or an object keyed by
 * indicator type (e.g. {@code {"rsi": {"weight": 0.5, "period": 14}}}).
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SignalConfigParser {

    private final ObjectMapper objectMapper;

    public SignalConfig parse(String json) {
        if (json == null || json.isBlank()) {
            throw new InvalidSignalConfigException("Signal configuration is empty");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidSignalConfigException("Signal configuration is not valid JSON", e);
        }

        List<IndicatorConfig> configs = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                configs.add(readIndicator(node));
            }
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isObject()) {
                    throw new InvalidSignalConfigException("Indicator '" + field.getKey() + "' must be an object");
                }
                ObjectNode node = field.getValue().deepCopy();
                node.put("type", field.getKey().toLowerCase(Locale.ROOT));
                configs.add(readIndicator(node));
            }
        } else {
            throw new InvalidSignalConfigException("Signal configuration must be a JSON array or object");
        }

        if (configs.isEmpty()) {
            throw new InvalidSignalConfigException("Signal configuration has no indicators");
        }
        configs.forEach(this::validate);
        return new SignalConfig(List.copyOf(configs));
    }

    private IndicatorConfig readIndicator(JsonNode node) {
        if (!node.hasNonNull("type")) {
            throw new InvalidSignalConfigException("Indicator config is missing 'type': " + node);
        }
        try {
            return objectMapper.treeToValue(node, IndicatorConfig.class);
        } catch (JsonProcessingException e) {
            throw new InvalidSignalConfigException("Unsupported indicator config: " + node.get("type").asText(), e);
        }
    }

    private void validate(IndicatorConfig config) {
        if (Double.isNaN(config.getWeight()) || Double.isInfinite(config.getWeight()) || config.getWeight() < 0) {
            throw new InvalidSignalConfigException(config.getType() + " weight must be a finite value >= 0");
        }
        String problem = config.validate();
        if (problem != null) {
            throw new InvalidSignalConfigException(problem);
        }
    }
}
