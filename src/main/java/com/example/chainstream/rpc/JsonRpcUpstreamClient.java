package com.example.chainstream.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import javax.json.Json;
import javax.json.JsonArray;
import javax.json.JsonException;
import javax.json.JsonObject;
import javax.json.JsonReader;
import javax.json.JsonString;
import javax.json.JsonValue;

/**
 * {@link UpstreamClient} speaking Ethereum JSON-RPC over HTTP.
 *
 * Every call is a single POST bounded by the request timeout. Blocks and transactions are parsed into
 * typed values; pending transactions, logs and the sync status are handed on as raw JSON so their
 * shape reaches subscribers unchanged.
 */
public class JsonRpcUpstreamClient implements UpstreamClient {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcUpstreamClient.class);

    static final String GET_BLOCK_BY_NUMBER = "eth_getBlockByNumber";
    static final String BLOCK_NUMBER = "eth_blockNumber";
    static final String PENDING_TRANSACTIONS = "eth_pendingTransactions";
    static final String GET_LOGS = "eth_getLogs";
    static final String CHAIN_ID = "eth_chainId";
    static final String PEER_COUNT = "net_peerCount";
    static final String SYNCING = "eth_syncing";
    static final String GAS_PRICE = "eth_gasPrice";

    private final HttpClient httpClient;
    private final URI rpcUri;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcUpstreamClient(String rpcUrl, Duration connectTimeout, Duration requestTimeout,
                                 ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(connectTimeout).build(), URI.create(rpcUrl), requestTimeout,
                objectMapper);
    }

    JsonRpcUpstreamClient(HttpClient httpClient, URI rpcUri, Duration requestTimeout, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.rpcUri = rpcUri;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
    }

    @Override
    public BlockSummary latestHead() throws UpstreamException {
        JsonObject block = requireBlock(call(GET_BLOCK_BY_NUMBER, Json.createArrayBuilder()
                .add("latest")
                .add(false)
                .build()));
        return new BlockSummary(quantity(GET_BLOCK_BY_NUMBER, block, "number").longValueExact(),
                string(GET_BLOCK_BY_NUMBER, block, "hash"));
    }

    @Override
    public FullBlock blockWithTransactions(long number) throws UpstreamException {
        JsonObject block = requireBlock(call(GET_BLOCK_BY_NUMBER, Json.createArrayBuilder()
                .add(toHex(number))
                .add(true)
                .build()));

        List<ChainTransaction> transactions = new ArrayList<>();
        JsonValue txs = block.get("transactions");
        if (txs != null && txs.getValueType() == JsonValue.ValueType.ARRAY) {
            for (JsonValue tx : txs.asJsonArray()) {
                if (tx.getValueType() != JsonValue.ValueType.OBJECT) {
                    throw new UpstreamException(GET_BLOCK_BY_NUMBER, "expected transaction objects, got " + tx.getValueType());
                }
                transactions.add(parseTransaction(tx.asJsonObject()));
            }
        }

        return new FullBlock(
                quantity(GET_BLOCK_BY_NUMBER, block, "number").longValueExact(),
                string(GET_BLOCK_BY_NUMBER, block, "hash"),
                string(GET_BLOCK_BY_NUMBER, block, "parentHash"),
                quantity(GET_BLOCK_BY_NUMBER, block, "timestamp").longValue(),
                quantity(GET_BLOCK_BY_NUMBER, block, "gasUsed").longValue(),
                quantity(GET_BLOCK_BY_NUMBER, block, "gasLimit").longValue(),
                optionalQuantity(GET_BLOCK_BY_NUMBER, block, "difficulty", BigInteger.ZERO),
                optionalQuantity(GET_BLOCK_BY_NUMBER, block, "size", BigInteger.ZERO).longValue(),
                transactions);
    }

    @Override
    public long blockNumber() throws UpstreamException {
        return quantityResult(BLOCK_NUMBER, call(BLOCK_NUMBER, JsonValue.EMPTY_JSON_ARRAY)).longValueExact();
    }

    @Override
    public List<JsonNode> pendingTransactions() throws UpstreamException {
        return rawList(PENDING_TRANSACTIONS, call(PENDING_TRANSACTIONS, JsonValue.EMPTY_JSON_ARRAY));
    }

    @Override
    public List<JsonNode> logsInRange(long from, long to) throws UpstreamException {
        JsonObject filter = Json.createObjectBuilder()
                .add("fromBlock", toHex(from))
                .add("toBlock", toHex(to))
                .build();
        return rawList(GET_LOGS, call(GET_LOGS, Json.createArrayBuilder().add(filter).build()));
    }

    @Override
    public BigInteger chainId() throws UpstreamException {
        return quantityResult(CHAIN_ID, call(CHAIN_ID, JsonValue.EMPTY_JSON_ARRAY));
    }

    @Override
    public BigInteger peerCount() throws UpstreamException {
        return quantityResult(PEER_COUNT, call(PEER_COUNT, JsonValue.EMPTY_JSON_ARRAY));
    }

    @Override
    public JsonNode syncStatus() throws UpstreamException {
        return toNode(SYNCING, call(SYNCING, JsonValue.EMPTY_JSON_ARRAY));
    }

    @Override
    public BigInteger suggestedGasPrice() throws UpstreamException {
        return quantityResult(GAS_PRICE, call(GAS_PRICE, JsonValue.EMPTY_JSON_ARRAY));
    }

    /**
     * Perform one JSON-RPC call and return its {@code result} member
     */
    JsonValue call(String method, JsonArray params) throws UpstreamException {
        String rpcRequest = Json.createObjectBuilder()
                .add("jsonrpc", "2.0")
                .add("method", method)
                .add("params", params)
                .add("id", requestIds.incrementAndGet())
                .build()
                .toString();

        HttpRequest request = HttpRequest.newBuilder()
                .uri(rpcUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(rpcRequest))
                .build();

        log.debug("Calling {} on {}", method, rpcUri);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamException(method, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamException(method, "interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new UpstreamException(method, "status code " + response.statusCode() + ", response: " + response.body());
        }

        JsonObject jsonResponse;
        try (JsonReader jsonReader = Json.createReader(new StringReader(response.body()))) {
            jsonResponse = jsonReader.readObject();
        } catch (JsonException | IllegalStateException e) {
            throw new UpstreamException(method, "malformed response: " + e.getMessage(), e);
        }

        JsonValue error = jsonResponse.get("error");
        if (error != null && error.getValueType() != JsonValue.ValueType.NULL) {
            throw new UpstreamException(method, "RPC error " + error);
        }
        if (!jsonResponse.containsKey("result")) {
            throw new UpstreamException(method, "response has no result");
        }
        return jsonResponse.get("result");
    }

    private ChainTransaction parseTransaction(JsonObject tx) throws UpstreamException {
        BigInteger gasPrice = optionalQuantity(GET_BLOCK_BY_NUMBER, tx, "gasPrice", null);
        if (gasPrice == null) {
            gasPrice = optionalQuantity(GET_BLOCK_BY_NUMBER, tx, "maxFeePerGas", BigInteger.ZERO);
        }
        JsonValue to = tx.get("to");
        return new ChainTransaction(
                string(GET_BLOCK_BY_NUMBER, tx, "hash"),
                to instanceof JsonString ? ((JsonString) to).getString() : null,
                optionalQuantity(GET_BLOCK_BY_NUMBER, tx, "value", BigInteger.ZERO),
                gasPrice,
                quantity(GET_BLOCK_BY_NUMBER, tx, "gas").longValue(),
                quantity(GET_BLOCK_BY_NUMBER, tx, "nonce").longValue());
    }

    private static JsonObject requireBlock(JsonValue result) throws UpstreamException {
        if (result.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new UpstreamException(GET_BLOCK_BY_NUMBER, "block not found");
        }
        return result.asJsonObject();
    }

    private List<JsonNode> rawList(String method, JsonValue result) throws UpstreamException {
        List<JsonNode> items = new ArrayList<>();
        if (result.getValueType() == JsonValue.ValueType.NULL) {
            return items;
        }
        if (result.getValueType() != JsonValue.ValueType.ARRAY) {
            throw new UpstreamException(method, "expected an array result, got " + result.getValueType());
        }
        for (JsonValue item : result.asJsonArray()) {
            items.add(toNode(method, item));
        }
        return items;
    }

    private JsonNode toNode(String method, JsonValue value) throws UpstreamException {
        try {
            return objectMapper.readTree(value.toString());
        } catch (JsonProcessingException e) {
            throw new UpstreamException(method, "unreadable result: " + e.getOriginalMessage(), e);
        }
    }

    private static BigInteger quantityResult(String method, JsonValue result) throws UpstreamException {
        if (!(result instanceof JsonString)) {
            throw new UpstreamException(method, "expected a quantity, got " + result.getValueType());
        }
        return parseQuantity(method, ((JsonString) result).getString());
    }

    private static String string(String method, JsonObject object, String field) throws UpstreamException {
        JsonValue value = object.get(field);
        if (!(value instanceof JsonString)) {
            throw new UpstreamException(method, "missing field " + field);
        }
        return ((JsonString) value).getString();
    }

    private static BigInteger quantity(String method, JsonObject object, String field) throws UpstreamException {
        return parseQuantity(method, string(method, object, field));
    }

    private static BigInteger optionalQuantity(String method, JsonObject object, String field, BigInteger fallback)
            throws UpstreamException {
        JsonValue value = object.get(field);
        if (!(value instanceof JsonString)) {
            return fallback;
        }
        return parseQuantity(method, ((JsonString) value).getString());
    }

    static BigInteger parseQuantity(String method, String hex) throws UpstreamException {
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        if (digits.isEmpty()) {
            return BigInteger.ZERO;
        }
        try {
            return new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            throw new UpstreamException(method, "not a hex quantity: " + hex, e);
        }
    }

    static String toHex(long quantity) {
        return "0x" + Long.toHexString(quantity);
    }
}
