package com.rush.agent.service;

import com.rush.agent.model.ActionDecision;
import com.rush.agent.model.Priority;
import com.rush.agent.model.RiskAssessment;
import com.rush.agent.model.SessionType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
public class SessionClassifier {

    static final double FRAUD_RISK_THRESHOLD = 0.7;

    private static final List<String> PAYMENT_KEYWORDS = List.of("payment", "transfer", "send money");
    private static final List<String> FRAUD_KEYWORDS = List.of("fraud", "scam", "suspicious");
    private static final List<String> HIGH_PRIORITY_KEYWORDS = List.of("urgent", "emergency", "fraud");
    private static final List<String> MEDIUM_PRIORITY_KEYWORDS = List.of("payment", "transaction");

    public SessionType determineSessionType(String userQuery) {
        String query = normalize(userQuery);
        if (containsAny(query, PAYMENT_KEYWORDS)) {
            return SessionType.PAYMENT_PROCESSING;
        }
        if (containsAny(query, FRAUD_KEYWORDS)) {
            return SessionType.FRAUD_DETECTION;
        }
        return SessionType.VOICE_SUPPORT;
    }

    public Priority determinePriority(String userQuery) {
        String query = normalize(userQuery);
        if (containsAny(query, HIGH_PRIORITY_KEYWORDS)) {
            return Priority.HIGH;
        }
        if (containsAny(query, MEDIUM_PRIORITY_KEYWORDS)) {
            return Priority.MEDIUM;
        }
        return Priority.LOW;
    }

    public boolean requiresFraudDetection(String userQuery, RiskAssessment risk) {
        return containsAny(normalize(userQuery), FRAUD_KEYWORDS)
            || (risk != null && risk.exceeds(FRAUD_RISK_THRESHOLD));
    }

    public boolean requiresBlockchainAction(ActionDecision decision) {
        return decision != null && decision.isRequired() && !decision.isExplicitlyRejected();
    }

    private static String normalize(String userQuery) {
        return userQuery == null ? "" : userQuery.toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String query, List<String> keywords) {
        return keywords.stream().anyMatch(query::contains);
    }
}
