package com.rush.agent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.rush.agent.model.ActionDecision;
import com.rush.agent.model.RiskAssessment;
import org.springframework.stereotype.Component;

@Component
public class AgentResultInterpreter {

    private final ObjectMapper mapper = new ObjectMapper();

    public JsonNode parse(String content) {
        if (content == null || content.isBlank()) {
            return TextNode.valueOf(content == null ? "" : content);
        }
        String trimmed = content.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            try {
                return mapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                return TextNode.valueOf(content);
            }
        }
        return TextNode.valueOf(content);
    }

    public RiskAssessment riskOf(JsonNode result) {
        JsonNode score = field(result, "risk_score", "riskScore");
        if (score == null || !score.isNumber()) {
            return RiskAssessment.NONE;
        }
        return new RiskAssessment(score.asDouble());
    }

    public ActionDecision actionOf(JsonNode result) {
        JsonNode required = field(result, "requires_blockchain_action", "requiresBlockchainAction");
        if (required == null) {
            return ActionDecision.NONE;
        }
        JsonNode approved = field(result, "approved", "approved");
        Boolean approval = approved != null && approved.isBoolean() ? approved.asBoolean() : null;
        return new ActionDecision(isTruthy(required), approval);
    }

    public String render(JsonNode payload) {
        if (payload == null) {
            return "null";
        }
        return payload.isTextual() ? payload.asText() : payload.toString();
    }

    public ObjectNode errorPayload(String stage, String reason, String message) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", message);
        node.put("reason", reason);
        if (stage != null) {
            node.put("stage", stage);
        }
        return node;
    }

    private static JsonNode field(JsonNode result, String snake, String camel) {
        if (result == null || !result.isObject()) {
            return null;
        }
        JsonNode value = result.get(snake);
        if (value == null || value.isNull()) {
            value = result.get(camel);
        }
        return value == null || value.isNull() ? null : value;
    }

    private static boolean isTruthy(JsonNode value) {
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.asDouble() != 0;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty() && !"false".equalsIgnoreCase(value.asText());
        }
        return value.isContainerNode();
    }
}
