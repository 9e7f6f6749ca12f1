package com.walletd.node;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.walletd.config.CaffeineConfig;
import com.walletd.domain.Outpoint;
import com.walletd.domain.ScriptPublicKey;
import com.walletd.domain.TransactionInput;
import com.walletd.domain.TransactionOutput;
import com.walletd.domain.UtxoEntry;
import com.walletd.domain.WalletTransaction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link NodeClient} over JSON-RPC. Calls are retried across endpoints with backoff, responses parsed as
 * Jackson trees. Entries that cannot be parsed are returned incomplete rather than failing the whole call.
 */
@Slf4j
public class JsonRpcNodeClient implements NodeClient {

    static final String SUBNETWORK_ID_NATIVE = "0".repeat(40);

    private final NodeRpcTransport transport;
    private final NodeEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public JsonRpcNodeClient(NodeRpcTransport transport, NodeEndpointRotator rotator, RateLimiter rateLimiter,
                             ObjectMapper objectMapper) {
        this.transport = transport;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<NodeUtxoEntry> getUtxosByAddresses(List<String> addresses) {
        JsonNode result = callWithRetry("getUtxosByAddresses", Map.of("addresses", addresses));
        List<NodeUtxoEntry> out = new ArrayList<>();
        for (JsonNode e : result.path("entries")) {
            out.add(new NodeUtxoEntry(textOrNull(e.get("address")), parseOutpoint(e.get("outpoint")), parseUtxoEntry(e.get("utxoEntry"))));
        }
        return out;
    }

    @Override
    public List<MempoolEntriesByAddress> getMempoolEntriesByAddresses(List<String> addresses) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("addresses", addresses);
        params.put("includeOrphanPool", false);
        params.put("filterTransactionPool", false);
        JsonNode result = callWithRetry("getMempoolEntriesByAddresses", params);
        List<MempoolEntriesByAddress> out = new ArrayList<>();
        for (JsonNode e : result.path("entries")) {
            out.add(new MempoolEntriesByAddress(textOrNull(e.get("address")),
                    parseMempoolEntries(e.path("sending")), parseMempoolEntries(e.path("receiving"))));
        }
        return out;
    }

    @Override
    public long getVirtualDaaScore() {
        JsonNode result = callWithRetry("getBlockDagInfo", Map.of());
        JsonNode score = result.get("virtualDaaScore");
        if (score == null || score.isNull()) {
            throw new RpcException("getBlockDagInfo response has no virtualDaaScore");
        }
        try {
            return parseAmount(score);
        } catch (NumberFormatException e) {
            throw new RpcException("Invalid virtualDaaScore " + score, e);
        }
    }

    @Override
    @Cacheable(CaffeineConfig.FEE_ESTIMATE_CACHE)
    public double getFeeEstimate() {
        JsonNode estimate = callWithRetry("getFeeEstimate", Map.of()).path("estimate");
        JsonNode normal = estimate.path("normalBuckets");
        JsonNode bucket = normal.isArray() && normal.size() > 0 ? normal.get(0) : estimate.path("priorityBucket");
        JsonNode feerate = bucket.get("feerate");
        if (feerate == null || !feerate.isNumber()) {
            throw new RpcException("getFeeEstimate response has no feerate");
        }
        return feerate.asDouble();
    }

    @Override
    public String submitTransaction(WalletTransaction transaction) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("transaction", toRpcTransaction(transaction));
        params.put("allowOrphan", false);
        // no retry: a resubmission after an ambiguous failure could be reported as a double spend
        JsonNode result = callOnce(rotator.nextEndpoint(), "submitTransaction", params);
        String id = textOrNull(result.get("transactionId"));
        if (id == null) {
            throw new RpcException("submitTransaction response has no transactionId");
        }
        return id;
    }

    private JsonNode callWithRetry(String method, Object params) {
        Exception lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.nextEndpoint();
            try {
                return callOnce(endpoint, method, params);
            } catch (RpcException e) {
                lastException = e;
                rotator.markFailed(endpoint, messageOf(e));
                log.debug("{} on {} failed (attempt {}): {}", method, endpoint, attempt + 1, messageOf(e));
            }
        }
        throw new RpcException(method + " failed after " + rotator.getMaxAttempts() + " attempts: " + messageOf(lastException), lastException);
    }

    private JsonNode callOnce(String endpoint, String method, Object params) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        String json;
        try {
            json = transport.call(endpoint, method, params).block();
        } catch (RpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RpcException(method + " on " + endpoint + ": " + messageOf(e), e);
        }
        if (json == null || json.isBlank()) {
            throw new RpcException("Empty response to " + method);
        }
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root.has("error") && !root.get("error").isNull()) {
                throw new RpcException("RPC error from " + method + ": " + root.get("error"));
            }
            return root.path("result");
        } catch (JsonProcessingException e) {
            throw new RpcException("Unparseable response to " + method, e);
        }
    }

    private List<MempoolEntry> parseMempoolEntries(JsonNode array) {
        List<MempoolEntry> out = new ArrayList<>();
        for (JsonNode e : array) {
            JsonNode tx = e.path("transaction");
            List<Outpoint> inputs = new ArrayList<>();
            int malformedInputs = 0;
            for (JsonNode in : tx.path("inputs")) {
                Outpoint o = parseOutpoint(in.get("previousOutpoint"));
                if (o != null) {
                    inputs.add(o);
                } else {
                    log.warn("Mempool transaction {} has an input without a usable previous outpoint: {}",
                            textOrNull(tx.path("verboseData").get("transactionId")), in);
                    malformedInputs++;
                }
            }
            List<MempoolOutput> outputs = new ArrayList<>();
            int index = -1;
            for (JsonNode o : tx.path("outputs")) {
                index++;
                ScriptPublicKey spk = parseScript(o.get("scriptPublicKey"));
                JsonNode value = o.get("value");
                if (spk == null || value == null) {
                    continue;
                }
                try {
                    outputs.add(new MempoolOutput(index, parseAmount(value), spk, textOrNull(o.path("verboseData").get("scriptPublicKeyAddress"))));
                } catch (IllegalArgumentException ex) {
                    log.debug("Malformed mempool output {}: {}", o, ex.getMessage());
                }
            }
            String id = textOrNull(tx.path("verboseData").get("transactionId"));
            out.add(new MempoolEntry(id, inputs, outputs, malformedInputs));
        }
        return out;
    }

    private Outpoint parseOutpoint(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return new Outpoint(node.path("transactionId").asText(), node.path("index").asInt(-1));
        } catch (IllegalArgumentException e) {
            log.debug("Malformed outpoint {}: {}", node, e.getMessage());
            return null;
        }
    }

    private UtxoEntry parseUtxoEntry(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        ScriptPublicKey spk = parseScript(node.get("scriptPublicKey"));
        if (spk == null || !node.has("amount")) {
            return null;
        }
        try {
            return new UtxoEntry(parseAmount(node.get("amount")), spk,
                    parseAmount(node.path("blockDaaScore")), node.path("isCoinbase").asBoolean(false));
        } catch (IllegalArgumentException e) {
            log.debug("Malformed UTXO entry {}: {}", node, e.getMessage());
            return null;
        }
    }

    private static ScriptPublicKey parseScript(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            if (node.isTextual()) {
                // compact form: 4 hex digits version followed by the script
                String s = node.asText();
                return new ScriptPublicKey(Integer.parseInt(s.substring(0, 4), 16), s.substring(4));
            }
            return new ScriptPublicKey(node.path("version").asInt(0), node.path("script").asText(""));
        } catch (IllegalArgumentException | StringIndexOutOfBoundsException e) {
            return null;
        }
    }

    private static long parseAmount(JsonNode node) {
        if (node.isTextual()) {
            return Long.parseLong(node.asText());
        }
        return node.asLong();
    }

    private static Map<String, Object> toRpcTransaction(WalletTransaction tx) {
        List<Map<String, Object>> inputs = new ArrayList<>();
        for (TransactionInput in : tx.inputs()) {
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("previousOutpoint", Map.of(
                    "transactionId", in.previousOutpoint().transactionId(),
                    "index", in.previousOutpoint().index()));
            input.put("signatureScript", in.signatureScriptHex());
            input.put("sequence", in.sequence());
            input.put("sigOpCount", in.sigOpCount());
            inputs.add(input);
        }
        List<Map<String, Object>> outputs = new ArrayList<>();
        for (TransactionOutput out : tx.outputs()) {
            outputs.add(Map.of(
                    "value", out.value(),
                    "scriptPublicKey", Map.of(
                            "version", out.scriptPublicKey().version(),
                            "script", out.scriptPublicKey().scriptHex())));
        }
        Map<String, Object> rpc = new LinkedHashMap<>();
        rpc.put("version", 0);
        rpc.put("inputs", inputs);
        rpc.put("outputs", outputs);
        rpc.put("lockTime", 0);
        rpc.put("subnetworkId", SUBNETWORK_ID_NATIVE);
        rpc.put("gas", 0);
        rpc.put("payload", tx.payloadHex());
        return rpc;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() || node.asText().isEmpty() ? null : node.asText();
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during node retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
