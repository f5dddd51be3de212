package com.rush.agent.transport;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.auth.AuthTestRequest;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.conversations.ConversationsRepliesRequest;
import com.slack.api.methods.response.auth.AuthTestResponse;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import com.slack.api.methods.response.conversations.ConversationsRepliesResponse;
import com.slack.api.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

// a mention is an @agent-id token at the start of a thread reply
@Slf4j
public class SlackThreadTransport implements ThreadTransport {

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    @Value("${rush.transport.slack.channel:}")
    private String channel;

    @Value("${rush.transport.agent-id:rush-orchestrator}")
    private String orchestratorId = "rush-orchestrator";

    @Value("${rush.transport.slack.poll-interval-ms:1000}")
    private long pollIntervalMs = 1000;

    private final Slack slack;
    private final Clock clock;
    private final Map<String, String> lastSeenTs = new ConcurrentHashMap<>();

    private volatile String botUserId;
    private volatile boolean connected;

    public SlackThreadTransport(Slack slack, Clock clock) {
        this.slack = slack;
        this.clock = clock;
    }

    public void setSlackBotToken(String slackBotToken) {
        this.slackBotToken = slackBotToken;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public void setOrchestratorId(String orchestratorId) {
        this.orchestratorId = orchestratorId;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public void connect() {
        try {
            AuthTestResponse response = methods().authTest(AuthTestRequest.builder().build());
            if (!response.isOk()) {
                throw new ThreadTransportException("Slack auth.test failed: " + response.getError());
            }
            botUserId = response.getUserId();
            connected = true;
            log.info("Connected to Slack as {} (team {})", botUserId, response.getTeam());
        } catch (IOException | SlackApiException e) {
            throw new ThreadTransportException("Slack auth.test failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String createThread(String name, List<String> participantIds) {
        requireConnected();
        String text = String.format("*%s*\nParticipants: %s", name, mentionTokens(participantIds));
        ChatPostMessageResponse response = post(ChatPostMessageRequest.builder()
            .channel(channel)
            .text(text)
            .build());
        lastSeenTs.put(response.getTs(), response.getTs());
        return response.getTs();
    }

    @Override
    public TransportMessage sendMessage(String threadId, String content, List<String> mentions) {
        requireConnected();
        List<String> addressed = mentions != null ? mentions : List.of();
        String text = addressed.isEmpty() ? content : mentionTokens(addressed) + " " + content;

        ChatPostMessageResponse response = post(ChatPostMessageRequest.builder()
            .channel(channel)
            .threadTs(threadId)
            .text(text)
            .build());

        return TransportMessage.builder()
            .id(response.getTs())
            .threadId(threadId)
            .agentId(orchestratorId)
            .content(content)
            .timestamp(timestampOf(response.getTs()))
            .mentions(new ArrayList<>(addressed))
            .build();
    }

    @Override
    public TransportMessage waitForMentions(String threadId, long timeoutMs) {
        requireConnected();
        long deadline = System.nanoTime() + timeoutMs * 1_000_000L;
        String cursor = lastSeenTs.getOrDefault(threadId, threadId);

        while (true) {
            for (Message message : fetchReplies(threadId, cursor)) {
                if (compareTs(message.getTs(), cursor) <= 0) {
                    continue;
                }
                cursor = message.getTs();
                lastSeenTs.put(threadId, cursor);
                if (isAddressedToOrchestrator(message)) {
                    return toTransportMessage(threadId, message);
                }
            }

            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                throw new TransportTimeoutException(threadId, timeoutMs);
            }
            try {
                Thread.sleep(Math.min(pollIntervalMs, remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ThreadTransportException("Interrupted while waiting on thread " + threadId, e);
            }
        }
    }

    @Override
    public boolean addParticipant(String threadId, String agentId) {
        requireConnected();
        post(ChatPostMessageRequest.builder()
            .channel(channel)
            .threadTs(threadId)
            .text(mentionTokens(List.of(agentId)) + " joined the session")
            .build());
        return true;
    }

    @Override
    public void releaseThread(String threadId) {
        lastSeenTs.remove(threadId);
    }

    String mentionTokens(List<String> agentIds) {
        return agentIds.stream().map(id -> "@" + id).collect(Collectors.joining(" "));
    }

    private List<Message> fetchReplies(String threadId, String oldest) {
        try {
            ConversationsRepliesResponse response = methods().conversationsReplies(
                ConversationsRepliesRequest.builder()
                    .channel(channel)
                    .ts(threadId)
                    .oldest(oldest)
                    .build());
            if (!response.isOk()) {
                throw new ThreadTransportException("Failed to read thread " + threadId + ": " + response.getError());
            }
            return response.getMessages() != null ? response.getMessages() : List.of();
        } catch (IOException | SlackApiException e) {
            throw new ThreadTransportException("Failed to read thread " + threadId + ": " + e.getMessage(), e);
        }
    }

    private ChatPostMessageResponse post(ChatPostMessageRequest request) {
        try {
            ChatPostMessageResponse response = methods().chatPostMessage(request);
            if (!response.isOk()) {
                throw new ThreadTransportException("Failed to post message: " + response.getError());
            }
            return response;
        } catch (IOException | SlackApiException e) {
            throw new ThreadTransportException("Failed to post message: " + e.getMessage(), e);
        }
    }

    private boolean isAddressedToOrchestrator(Message message) {
        if (message.getText() == null) {
            return false;
        }
        if (botUserId != null && botUserId.equals(message.getUser())) {
            return false;
        }
        return message.getText().contains("@" + orchestratorId)
            || (botUserId != null && message.getText().contains("<@" + botUserId + ">"));
    }

    private TransportMessage toTransportMessage(String threadId, Message message) {
        String content = message.getText().replace("@" + orchestratorId, "");
        if (botUserId != null) {
            content = content.replace("<@" + botUserId + ">", "");
        }
        return TransportMessage.builder()
            .id(message.getTs())
            .threadId(threadId)
            .agentId(message.getUser() != null ? message.getUser() : message.getBotId())
            .content(content.trim())
            .timestamp(timestampOf(message.getTs()))
            .mentions(new ArrayList<>(List.of(orchestratorId)))
            .build();
    }

    private void requireConnected() {
        if (!connected) {
            throw new ThreadTransportException("Slack transport is not connected");
        }
    }

    private Instant timestampOf(String ts) {
        return ts != null ? toInstant(ts) : clock.instant();
    }

    private MethodsClient methods() {
        return slack.methods(slackBotToken);
    }

    static int compareTs(String left, String right) {
        return new BigDecimal(left).compareTo(new BigDecimal(right));
    }

    static Instant toInstant(String ts) {
        BigDecimal micros = new BigDecimal(ts).movePointRight(6);
        long value = micros.longValue();
        return Instant.ofEpochSecond(value / 1_000_000L, (value % 1_000_000L) * 1_000L);
    }
}
