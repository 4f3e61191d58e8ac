package com.repairdesk.sync.client.impl.production;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairdesk.sync.client.EntityStoreClient;
import com.repairdesk.sync.exception.MutationRejectedException;
import com.repairdesk.sync.exception.ResyncFailureException;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Talks to the store's PostgREST-style row API. Filters use the {@code column=op.value}
 * query syntax and writes ask for the stored row back with {@code Prefer: return=representation}.
 */
@Slf4j
@Service
@Profile("!test & !local")
public class RestEntityStoreClient implements EntityStoreClient {

    static final String CIRCUIT_BREAKER = "storeCircuitBreaker";
    private static final String RETURN_REPRESENTATION = "return=representation";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    public RestEntityStoreClient(@Qualifier("storeRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 CircuitBreakerRegistry cbRegistry) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        // thresholds live under resilience4j.circuitbreaker.instances.storeCircuitBreaker
        this.circuitBreaker = cbRegistry.circuitBreaker(CIRCUIT_BREAKER);
    }

    @Override
    public List<TrackedEntity> fetchAll(EntityKind kind, ViewScope scope) {
        try {
            return guarded(() -> {
                UriComponentsBuilder uri = UriComponentsBuilder.fromPath("/" + kind.getTable())
                        .queryParam("select", "*")
                        .queryParam("order", "created_at.desc");
                if (!scope.isAdmin()) {
                    if (kind == EntityKind.CHAT_MESSAGE) {
                        List<String> conversations = ownBookingIds(scope.viewerId());
                        if (conversations.isEmpty()) {
                            return Collections.<TrackedEntity>emptyList();
                        }
                        uri.queryParam("conversation_id", "in.(" + String.join(",", conversations) + ")");
                    } else {
                        uri.queryParam("user_id", "eq." + scope.viewerId());
                    }
                }
                List<TrackedEntity> rows = toEntities(kind, exchange(uri.toUriString(), HttpMethod.GET, null));
                log.debug("STORE_API: Fetched {} {} row(s) for viewer {}", rows.size(), kind.getTable(), scope.viewerId());
                return rows;
            });
        } catch (RuntimeException e) {
            log.error("STORE_API: Full fetch of {} for viewer {} failed: {}", kind.getTable(), scope.viewerId(), e.getMessage());
            throw new ResyncFailureException(kind, "Full fetch of " + kind.getTable() + " failed", e);
        }
    }

    @Override
    public Optional<TrackedEntity> fetchOne(EntityKind kind, String id) {
        String url = UriComponentsBuilder.fromPath("/" + kind.getTable())
                .queryParam("select", "*")
                .queryParam("id", "eq." + id)
                .toUriString();
        try {
            List<TrackedEntity> rows = guarded(() -> toEntities(kind, exchange(url, HttpMethod.GET, null)));
            return rows.stream().findFirst();
        } catch (RuntimeException e) {
            log.error("STORE_API: Failed to fetch {} {}: {}", kind.getTable(), id, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public TrackedEntity mutate(EntityKind kind, String id, Map<String, Object> patch) {
        String url = UriComponentsBuilder.fromPath("/" + kind.getTable())
                .queryParam("id", "eq." + id)
                .toUriString();
        List<TrackedEntity> rows = write(kind, id, () -> toEntities(kind, exchange(url, HttpMethod.PATCH, patch)));
        if (rows.isEmpty()) {
            throw new MutationRejectedException(kind, id,
                    "No " + kind.getTable() + " row " + id + " was updated (missing or not permitted)", false);
        }
        log.debug("STORE_API: Updated {} {} with {}", kind.getTable(), id, patch.keySet());
        return rows.get(0);
    }

    @Override
    public TrackedEntity insert(EntityKind kind, Map<String, Object> row) {
        String url = UriComponentsBuilder.fromPath("/" + kind.getTable()).toUriString();
        List<TrackedEntity> rows = write(kind, null, () -> toEntities(kind, exchange(url, HttpMethod.POST, row)));
        if (rows.isEmpty()) {
            throw new MutationRejectedException(kind, null, "Insert into " + kind.getTable() + " returned no row", false);
        }
        log.debug("STORE_API: Inserted {} {}", kind.getTable(), rows.get(0).getId());
        return rows.get(0);
    }

    @Override
    public void bulkMarkRead(String conversationId, String excludeSenderId) {
        String url = UriComponentsBuilder.fromPath("/" + EntityKind.CHAT_MESSAGE.getTable())
                .queryParam("conversation_id", "eq." + conversationId)
                .queryParam("sender_id", "neq." + excludeSenderId)
                .queryParam("is_read", "eq.false")
                .toUriString();
        write(EntityKind.CHAT_MESSAGE, conversationId,
                () -> exchange(url, HttpMethod.PATCH, Map.of("is_read", true)));
        log.debug("STORE_API: Marked conversation {} as read for {}", conversationId, excludeSenderId);
    }

    private List<String> ownBookingIds(String viewerId) {
        String url = UriComponentsBuilder.fromPath("/" + EntityKind.BOOKING.getTable())
                .queryParam("select", "id")
                .queryParam("user_id", "eq." + viewerId)
                .toUriString();
        JsonNode body = exchange(url, HttpMethod.GET, null);
        List<String> ids = new ArrayList<>();
        if (body != null) {
            body.forEach(row -> ids.add(row.path("id").asText()));
        }
        return ids;
    }

    private JsonNode exchange(String url, HttpMethod method, Object body) {
        HttpHeaders headers = new HttpHeaders();
        if (method != HttpMethod.GET) {
            headers.set("Prefer", RETURN_REPRESENTATION);
        }
        ResponseEntity<JsonNode> response = restTemplate.exchange(url, method, new HttpEntity<>(body, headers), JsonNode.class);
        return response.getBody();
    }

    private <T> T write(EntityKind kind, String id, Supplier<T> request) {
        try {
            return guarded(request);
        } catch (HttpStatusCodeException e) {
            boolean clientError = e.getStatusCode().is4xxClientError();
            log.error("STORE_API: {} write on {} {} rejected with {}: {}", clientError ? "Permanent" : "Transient",
                    kind.getTable(), id, e.getStatusCode(), e.getResponseBodyAsString());
            throw new MutationRejectedException(kind, id, "Store rejected the write: " + e.getStatusCode(), !clientError, e);
        } catch (CallNotPermittedException e) {
            log.warn("STORE_API: Circuit open, write on {} {} not attempted", kind.getTable(), id);
            throw new MutationRejectedException(kind, id, "Store temporarily unavailable", true, e);
        } catch (RestClientException e) {
            log.error("STORE_API: Write on {} {} failed: {}", kind.getTable(), id, e.getMessage());
            throw new MutationRejectedException(kind, id, "Store unreachable", true, e);
        }
    }

    private <T> T guarded(Supplier<T> request) {
        return circuitBreaker.executeSupplier(request);
    }

    private List<TrackedEntity> toEntities(EntityKind kind, JsonNode body) {
        if (body == null || !body.isArray()) {
            return Collections.emptyList();
        }
        List<TrackedEntity> rows = new ArrayList<>(body.size());
        for (JsonNode row : body) {
            try {
                rows.add(objectMapper.treeToValue(row, kind.getEntityClass()));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("STORE_API: Skipping unreadable {} row {}: {}", kind.getTable(), row.path("id").asText(), e.getMessage());
            }
        }
        return rows;
    }
}
