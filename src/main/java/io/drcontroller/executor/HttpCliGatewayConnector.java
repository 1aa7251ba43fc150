package io.drcontroller.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Runs cluster CLI commands through an HTTP gateway in front of each cluster.
 *
 * Request: POST to the URL template with {cluster} substituted, body {"command": "..."}.
 * Response: {"output": "...", "error": "..."}. Authentication is HTTP basic.
 */
@Slf4j
public class HttpCliGatewayConnector implements ClusterConnector {

    public static final String CLUSTER_PLACEHOLDER = "{cluster}";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String urlTemplate;
    private final String authorization;
    private final Duration requestTimeout;

    public HttpCliGatewayConnector(String urlTemplate, String username, String password,
                                   Duration connectTimeout, Duration requestTimeout, ObjectMapper objectMapper) {
        if (urlTemplate == null || !urlTemplate.contains(CLUSTER_PLACEHOLDER)) {
            throw new IllegalArgumentException("Gateway URL template must contain " + CLUSTER_PLACEHOLDER);
        }
        this.urlTemplate = urlTemplate;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.authorization = "Basic " + Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }

    @Override
    public ClusterSession open(String cluster) throws ConnectionException {
        if (cluster == null || cluster.isBlank()) {
            throw new ConnectionException("Cluster name cannot be null or empty");
        }
        URI endpoint;
        try {
            endpoint = URI.create(urlTemplate.replace(CLUSTER_PLACEHOLDER, cluster.trim()));
        } catch (IllegalArgumentException e) {
            throw new ConnectionException("Invalid gateway URL for cluster " + cluster + ": " + e.getMessage(), e);
        }
        log.debug("Opened gateway session for cluster {} at {}", cluster, endpoint);
        return new GatewaySession(cluster, endpoint);
    }

    private class GatewaySession implements ClusterSession {

        private final String cluster;
        private final URI endpoint;

        GatewaySession(String cluster, URI endpoint) {
            this.cluster = cluster;
            this.endpoint = endpoint;
        }

        @Override
        public String getCluster() {
            return cluster;
        }

        @Override
        public CommandOutput execute(String command) throws ConnectionException {
            String body;
            try {
                ObjectNode payload = objectMapper.createObjectNode();
                payload.put("command", command);
                body = objectMapper.writeValueAsString(payload);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to encode command for cluster " + cluster, e);
            }

            HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Authorization", authorization)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

            log.debug("[{}] > {}", cluster, command);
            long startTime = System.currentTimeMillis();
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (ConnectException e) {
                throw new ConnectionException("Cannot connect to gateway for cluster " + cluster + " at " + endpoint, e);
            } catch (IOException e) {
                throw new ConnectionException("I/O error talking to cluster " + cluster + ": " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while waiting for cluster " + cluster, e);
            }
            long duration = System.currentTimeMillis() - startTime;
            log.debug("[{}] < status={} duration={}ms", cluster, response.statusCode(), duration);

            int status = response.statusCode();
            if (status == 401 || status == 403) {
                throw new ConnectionException("Authentication to cluster " + cluster + " failed (HTTP " + status + ")");
            }
            if (status < 200 || status >= 300) {
                return new CommandOutput("", "HTTP " + status + " from gateway: " + response.body());
            }
            return decode(response.body());
        }

        private CommandOutput decode(String responseBody) throws ConnectionException {
            try {
                JsonNode node = objectMapper.readTree(responseBody);
                String output = node.path("output").asText("");
                String error = node.path("error").asText("");
                return new CommandOutput(output, error);
            } catch (IOException e) {
                throw new ConnectionException("Malformed gateway response from cluster " + cluster + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            log.debug("Closed gateway session for cluster {}", cluster);
        }
    }
}
