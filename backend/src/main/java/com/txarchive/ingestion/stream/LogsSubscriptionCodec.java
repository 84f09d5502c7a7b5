package com.txarchive.ingestion.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txarchive.domain.TransactionNotice;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds the logsSubscribe request and normalizes inbound frames into {@link StreamFrame}s.
 * <p>
 * Notification shape:
 * {@code {"method":"logsNotification","params":{"result":{"context":{"slot":N},"value":{"signature":"..","err":null,"logs":[..]}},"subscription":ID}}}
 */
public class LogsSubscriptionCodec {

    static final long SUBSCRIBE_REQUEST_ID = 1L;

    /** Base58-encoded 64-byte ed25519 signature. */
    private static final Pattern SIGNATURE = Pattern.compile("[1-9A-HJ-NP-Za-km-z]{64,88}");

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String commitment;
    private final boolean includeVotes;
    private final boolean skipFailed;

    public LogsSubscriptionCodec(ObjectMapper objectMapper, Clock clock, String commitment,
                                 boolean includeVotes, boolean skipFailed) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.commitment = commitment;
        this.includeVotes = includeVotes;
        this.skipFailed = skipFailed;
    }

    public String subscribeRequest() {
        Map<String, Object> request = Map.of(
                "jsonrpc", "2.0",
                "id", SUBSCRIBE_REQUEST_ID,
                "method", "logsSubscribe",
                "params", List.of(includeVotes ? "allWithVotes" : "all", Map.of("commitment", commitment))
        );
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode logsSubscribe request", e);
        }
    }

    public StreamFrame decode(String frame, String sourceUrl) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            return StreamFrame.unreadable("invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return StreamFrame.unreadable("not a JSON object");
        }
        if ("logsNotification".equals(root.path("method").asText())) {
            return decodeNotification(root.path("params").path("result"), sourceUrl);
        }
        if (root.has("id") && root.path("id").asLong() == SUBSCRIBE_REQUEST_ID) {
            JsonNode error = root.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                return StreamFrame.rejected(error.toString());
            }
            JsonNode result = root.path("result");
            if (result.isIntegralNumber()) {
                return StreamFrame.subscribed(result.asLong());
            }
        }
        return StreamFrame.ignored();
    }

    private StreamFrame decodeNotification(JsonNode result, String sourceUrl) {
        JsonNode value = result.path("value");
        String signature = value.path("signature").asText("");
        if (signature.isBlank()) {
            return StreamFrame.unreadable("notification without signature");
        }
        if (!SIGNATURE.matcher(signature).matches()) {
            return StreamFrame.unreadable("malformed signature '" + signature + "'");
        }
        JsonNode err = value.path("err");
        if (skipFailed && !err.isMissingNode() && !err.isNull()) {
            return StreamFrame.skipped(signature);
        }
        long slot = result.path("context").path("slot").asLong(0L);
        return StreamFrame.notice(new TransactionNotice(signature, slot, clock.instant(), sourceUrl));
    }
}
