package com.rush.agent.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SimulatedAgents {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern QUOTED = Pattern.compile("\"(.*)\"");
    private static final Pattern AMOUNT = Pattern.compile("\\$\\s?([0-9][0-9,]*(?:\\.[0-9]+)?)");

    private SimulatedAgents() {
    }

    public static void registerAll(LocalThreadTransport transport) {
        transport.registerResponder("rush-voice-listener", SimulatedAgents::listen);
        transport.registerResponder("rush-brain-agent", SimulatedAgents::analyze);
        transport.registerResponder("rush-fraud-detector", SimulatedAgents::screen);
        transport.registerResponder("rush-executor-agent", SimulatedAgents::execute);
    }

    static Optional<String> listen(TransportMessage request) {
        Matcher matcher = QUOTED.matcher(request.getContent());
        String transcription = matcher.find() ? matcher.group(1) : request.getContent();

        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("transcription", transcription);
        reply.put("confidence", 0.95);
        reply.put("language", "en");
        return Optional.of(reply.toString());
    }

    static Optional<String> analyze(TransportMessage request) {
        String transcription = payloadOf(request).path("transcription").asText(request.getContent());
        String text = transcription.toLowerCase(Locale.ROOT);

        double riskScore = 0.3;
        if (text.contains("scam") || text.contains("fraud") || text.contains("suspicious")) {
            riskScore += 0.5;
        }
        double amount = extractAmount(transcription);
        if (amount > 50000) {
            riskScore += 0.2;
        }
        riskScore = Math.min(riskScore, 1.0);

        String intent;
        boolean actionRequired;
        if (text.contains("send") || text.contains("payment") || text.contains("transfer")) {
            intent = "payment_transfer";
            actionRequired = true;
        } else if (text.contains("transaction") || text.contains("mint") || text.contains("nft")) {
            intent = "transaction_support";
            actionRequired = true;
        } else {
            intent = "general_support";
            actionRequired = false;
        }

        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("intent", intent);
        reply.put("confidence", 0.95);
        reply.put("risk_score", riskScore);
        reply.put("risk_level", riskScore < 0.5 ? "low" : riskScore < 0.8 ? "medium" : "high");
        reply.put("requires_blockchain_action", actionRequired);
        reply.put("approved", riskScore < 0.9);
        if (amount > 0) {
            reply.put("amount", amount);
        }
        return Optional.of(reply.toString());
    }

    static Optional<String> screen(TransportMessage request) {
        double riskScore = payloadOf(request).path("risk_score").asDouble(0.0);

        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("risk_score", riskScore);
        reply.put("approved", riskScore < 0.9);
        reply.putArray("checks").add("velocity").add("destination_compliance").add("pattern_match");
        return Optional.of(reply.toString());
    }

    static Optional<String> execute(TransportMessage request) {
        ObjectNode reply = MAPPER.createObjectNode();
        reply.put("status", "executed");
        reply.put("transaction_id", "tx_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16));
        reply.put("network", "solana-devnet");
        return Optional.of(reply.toString());
    }

    private static JsonNode payloadOf(TransportMessage request) {
        String content = request.getContent();
        int start = content.indexOf('{');
        if (start < 0) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(content.substring(start));
        } catch (JsonProcessingException e) {
            return MAPPER.createObjectNode();
        }
    }

    private static double extractAmount(String text) {
        Matcher matcher = AMOUNT.matcher(text);
        if (!matcher.find()) {
            return 0;
        }
        return Double.parseDouble(matcher.group(1).replace(",", ""));
    }
}
