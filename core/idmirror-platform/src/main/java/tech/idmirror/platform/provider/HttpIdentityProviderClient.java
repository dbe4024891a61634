package tech.idmirror.platform.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * {@link IdentityProviderClient} over the provider's JSON HTTP API.
 *
 * <p>Every non-2xx answer becomes a {@link ProviderHttpException}; I/O failures become
 * {@link ProviderNetworkException} or {@link ProviderTimeoutException}.
 */
@ApplicationScoped
public class HttpIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(HttpIdentityProviderClient.class);

    private final HttpClient httpClient;
    private final IdentityProviderConfig config;
    private final ObjectMapper objectMapper;

    @Inject
    public HttpIdentityProviderClient(IdentityProviderConfig config, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.connectTimeout())
                .build(),
            config, objectMapper);
    }

    HttpIdentityProviderClient(HttpClient httpClient, IdentityProviderConfig config, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.config = config;
        this.objectMapper = objectMapper;
        LOG.infof("Identity provider client: baseUrl=%s, timeout=%s", config.baseUrl(), config.timeout());
    }

    @Override
    public RemoteUser getUser(String userId) {
        JsonNode body = send("GET", "/user_management/users/" + encode(userId), null);
        return objectMapper.convertValue(body, RemoteUser.class);
    }

    @Override
    public RemoteOrganization getOrganization(String organizationId) {
        JsonNode body = send("GET", "/organizations/" + encode(organizationId), null);
        return objectMapper.convertValue(body, RemoteOrganization.class);
    }

    @Override
    public List<RemoteMembership> listMemberships(String userId, String organizationId) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("user_id", userId);
        query.put("organization_id", organizationId);
        JsonNode body = send("GET", "/user_management/organization_memberships" + queryString(query), null);

        List<RemoteMembership> memberships = new ArrayList<>();
        for (JsonNode node : body.path("data")) {
            memberships.add(toMembership(node));
        }
        return memberships;
    }

    @Override
    public RemoteOrganization createOrganization(String name) {
        ObjectNode request = objectMapper.createObjectNode().put("name", name);
        JsonNode body = send("POST", "/organizations", request);
        return objectMapper.convertValue(body, RemoteOrganization.class);
    }

    @Override
    public RemoteMembership createOrganizationMembership(String userId, String organizationId, String roleSlug) {
        ObjectNode request = objectMapper.createObjectNode()
            .put("user_id", userId)
            .put("organization_id", organizationId)
            .put("role_slug", roleSlug);
        JsonNode body = send("POST", "/user_management/organization_memberships", request);
        return toMembership(body);
    }

    @Override
    public RemoteAuditEventPage listAuditEvents(String organizationId, int limit, String cursor) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("organization_id", organizationId);
        query.put("limit", String.valueOf(limit));
        query.put("after", cursor);
        JsonNode body = send("GET", "/audit_logs/events" + queryString(query), null);

        List<RemoteAuditEvent> events = new ArrayList<>();
        for (JsonNode node : body.path("data")) {
            events.add(objectMapper.convertValue(node, RemoteAuditEvent.class));
        }
        String next = body.path("list_metadata").path("after").asText(null);
        return new RemoteAuditEventPage(events, next);
    }

    /**
     * role arrives either as a plain slug or as {"slug": "..."}.
     */
    static RemoteMembership toMembership(JsonNode node) {
        JsonNode role = node.path("role");
        String slug = null;
        if (role.isObject()) {
            slug = role.path("slug").asText(null);
        } else if (role.isTextual()) {
            slug = role.asText();
        }
        return new RemoteMembership(
            node.path("id").asText(null),
            node.path("user_id").asText(null),
            node.path("organization_id").asText(null),
            slug,
            node.path("status").asText(null));
    }

    private JsonNode send(String method, String path, JsonNode requestBody) {
        URI uri = URI.create(config.baseUrl() + path);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(config.timeout())
            .header("Accept", "application/json");
        config.apiKey().ifPresent(key -> builder.header("Authorization", "Bearer " + key));

        if (requestBody != null) {
            builder.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(requestBody.toString()));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            LOG.warnf("Identity provider %s %s timed out after %s", method, path, config.timeout());
            throw new ProviderTimeoutException("Identity provider request timed out: " + method + " " + path,
                config.timeout(), e);
        } catch (IOException e) {
            LOG.warnf("Identity provider %s %s failed: %s", method, path, e.getMessage());
            throw new ProviderNetworkException("Identity provider unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderNetworkException("Interrupted while calling identity provider", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOG.debugf("Identity provider %s %s answered %d: %s", method, path, status, response.body());
            throw new ProviderHttpException(status,
                "Identity provider answered HTTP " + status + " for " + method + " " + path,
                response.body());
        }

        try {
            String body = response.body();
            return body == null || body.isBlank()
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderNetworkException("Malformed identity provider response for " + path, e);
        }
    }

    static String queryString(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&", "?", "");
        joiner.setEmptyValue("");
        for (Map.Entry<String, String> param : params.entrySet()) {
            if (param.getValue() != null) {
                joiner.add(encode(param.getKey()) + "=" + encode(param.getValue()));
            }
        }
        return joiner.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
