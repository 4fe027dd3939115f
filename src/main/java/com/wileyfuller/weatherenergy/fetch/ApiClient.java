package com.wileyfuller.weatherenergy.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.ResponseHandler;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * GETs JSON from the remote sources with the retry policy applied, consulting the fetch cache first.
 */
public class ApiClient implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ApiClient.class);

    public static final int DEFAULT_TIMEOUT_MS = 10_000;

    private final CloseableHttpClient httpclient;
    private final RetryPolicy retryPolicy;
    private final FetchCache cache;
    private final boolean bypassCache;
    private final ObjectMapper mapper;
    private final AtomicInteger requestsSent = new AtomicInteger();

    private final ResponseHandler<String> bodyHandler = new ResponseHandler<String>() {

        public String handleResponse(final HttpResponse response) throws ClientProtocolException, IOException {
            int status = response.getStatusLine().getStatusCode();
            if (status >= 200 && status < 300) {
                HttpEntity entity = response.getEntity();
                return entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : null;
            } else {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new ClientProtocolException("Unexpected response status: " + status);
            }
        }

    };

    /**
     * @param cache       may be null to run without memoization
     * @param bypassCache when true cached entries are ignored, but fresh responses are still stored
     */
    public ApiClient(CloseableHttpClient httpclient, RetryPolicy retryPolicy, FetchCache cache,
                     boolean bypassCache, ObjectMapper mapper) {
        this.httpclient = httpclient;
        this.retryPolicy = retryPolicy;
        this.cache = cache;
        this.bypassCache = bypassCache;
        this.mapper = mapper;
    }

    public static CloseableHttpClient createHttpClient(int timeoutMs) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeoutMs)
                .setConnectionRequestTimeout(timeoutMs)
                .setSocketTimeout(timeoutMs)
                .build();
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .setMaxConnPerRoute(16)
                .setMaxConnTotal(32)
                .build();
    }

    public JsonNode getJson(String source, URI uri, String fingerprint) throws FetchException {
        return getJson(source, uri, Collections.emptyMap(), fingerprint, body -> true);
    }

    /**
     * @param source      short name of the remote service, used in logs and as the cache source column
     * @param fingerprint cache key; must not contain credentials
     * @param cacheable   decides whether a fresh response is worth memoizing
     */
    public JsonNode getJson(String source, URI uri, Map<String, String> headers, String fingerprint,
                            Predicate<JsonNode> cacheable) throws FetchException {
        Optional<String> cached = lookup(fingerprint);
        if (cached.isPresent()) {
            LOG.debug("Cache hit for {} request {}", source, fingerprint);
            return parse(source, cached.get());
        }

        String body = retryPolicy.execute(source + " request", () -> {
            HttpGet httpget = new HttpGet(uri);
            for (Map.Entry<String, String> header : headers.entrySet()) {
                httpget.addHeader(header.getKey(), header.getValue());
            }
            requestsSent.incrementAndGet();
            return httpclient.execute(httpget, bodyHandler);
        });

        JsonNode root = parse(source, body);
        if (cacheable.test(root)) {
            store(fingerprint, source, body);
        }
        return root;
    }

    private JsonNode parse(String source, String body) throws FetchException {
        if (body == null || body.trim().isEmpty()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException("Malformed " + source + " response", e);
        }
    }

    private Optional<String> lookup(String fingerprint) {
        if (cache == null || bypassCache) {
            return Optional.empty();
        }
        try {
            return cache.get(fingerprint);
        } catch (SQLException e) {
            LOG.warn("Fetch cache lookup failed, going to the network: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String fingerprint, String source, String body) {
        if (cache == null) {
            return;
        }
        try {
            cache.put(fingerprint, source, body);
        } catch (SQLException e) {
            LOG.warn("Could not store {} response in fetch cache: {}", source, e.getMessage());
        }
    }

    /**
     * Number of HTTP requests actually sent, retries included.
     */
    public int getRequestsSent() {
        return requestsSent.get();
    }

    @Override
    public void close() throws IOException {
        httpclient.close();
    }
}
