package decentralabs.gmp.service.relay;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.web3j.utils.Numeric;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import decentralabs.gmp.dto.endpoint.DeliverRequest;
import decentralabs.gmp.dto.endpoint.DeliverResponse;
import decentralabs.gmp.dto.endpoint.OutboundBatchResponse;
import decentralabs.gmp.dto.endpoint.OutboundMessageResponse;
import decentralabs.gmp.dto.message.MessageType;
import decentralabs.gmp.exception.GmpErrorCode;
import decentralabs.gmp.exception.GmpException;
import decentralabs.gmp.service.endpoint.DeliveryReceipt;
import decentralabs.gmp.service.endpoint.OutboundMessage;
import decentralabs.gmp.util.Bytes32;
import decentralabs.gmp.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Talks to a chain hosted by another process through its REST endpoint.
 */
@Slf4j
public class HttpChainClient implements MailboxSource, DeliveryTarget {

    public static final String RELAY_HEADER = "X-Relay-Id";

    private static final MediaType JSON = MediaType.parse("application/json");

    private final long chainId;
    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public HttpChainClient(long chainId, String baseUrl, Duration timeout, ObjectMapper mapper) {
        this(chainId, baseUrl, new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .callTimeout(timeout)
            .build(), mapper);
    }

    HttpChainClient(long chainId, String baseUrl, OkHttpClient client, ObjectMapper mapper) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid URL for chain " + chainId + ": " + baseUrl);
        }
        this.chainId = chainId;
        this.baseUrl = parsed;
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public long chainId() {
        return chainId;
    }

    @Override
    public List<OutboundMessage> fetchOutbound(long afterNonce, int limit) {
        HttpUrl url = chainUrl()
            .addPathSegment("outbound")
            .addQueryParameter("afterNonce", Long.toString(afterNonce))
            .addQueryParameter("limit", Integer.toString(limit))
            .build();
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw toException(response.code(), body);
            }
            OutboundBatchResponse batch = mapper.readValue(body, OutboundBatchResponse.class);
            List<OutboundMessage> messages = new ArrayList<>();
            for (OutboundMessageResponse entry : batch.getMessages()) {
                messages.add(entry.toMessage());
            }
            return messages;
        } catch (IOException e) {
            throw new RelayTransportException("Outbound read from chain " + chainId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public DeliveryReceipt deliver(Bytes32 relay, long srcChainId, Bytes32 srcAddr, byte[] payload) {
        HttpUrl url = chainUrl().addPathSegment("deliver").build();
        try {
            DeliverRequest deliverRequest = new DeliverRequest(srcChainId, srcAddr.toHex(), Numeric.toHexString(payload));
            RequestBody body = RequestBody.create(mapper.writeValueAsString(deliverRequest), JSON);
            Request request = new Request.Builder()
                .url(url)
                .addHeader(RELAY_HEADER, relay.toHex())
                .post(body)
                .build();
            try (Response response = client.newCall(request).execute()) {
                String responseBody = readBody(response);
                if (!response.isSuccessful()) {
                    throw toException(response.code(), responseBody);
                }
                DeliverResponse delivered = mapper.readValue(responseBody, DeliverResponse.class);
                return new DeliveryReceipt(
                    delivered.getChainId(),
                    delivered.getSrcChainId(),
                    Bytes32.fromHex(delivered.getIntentId()),
                    MessageType.fromTag(payload[0]).orElse(null),
                    Bytes32.fromHex(delivered.getDeliveryKey()),
                    delivered.getHandlerCount()
                );
            }
        } catch (IOException e) {
            throw new RelayTransportException("Delivery to chain " + chainId + " failed: " + e.getMessage(), e);
        }
    }

    private HttpUrl.Builder chainUrl() {
        return baseUrl.newBuilder()
            .addPathSegment("chains")
            .addPathSegment(Long.toString(chainId));
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    /**
     * Maps an error response back to the endpoint's error code when it carries one.
     */
    private RuntimeException toException(int status, String body) {
        try {
            JsonNode node = mapper.readTree(body);
            JsonNode code = node != null ? node.get("code") : null;
            if (code != null && code.isTextual()) {
                GmpErrorCode errorCode = GmpErrorCode.valueOf(code.asText());
                JsonNode message = node.get("message");
                return new GmpException(errorCode, message != null ? message.asText() : errorCode.name());
            }
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Unparseable error body from chain {}: {}", chainId, LogSanitizer.sanitize(e.getMessage()));
        }
        return new RelayTransportException("Chain " + chainId + " responded with HTTP " + status);
    }
}
