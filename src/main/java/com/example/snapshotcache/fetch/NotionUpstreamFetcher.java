package com.example.snapshotcache.fetch;

import com.example.snapshotcache.config.NotionProperties;
import com.example.snapshotcache.exception.PermanentFetchException;
import com.example.snapshotcache.exception.TransientFetchException;
import com.example.snapshotcache.exception.UpstreamFetchException;
import com.example.snapshotcache.model.ResourceType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pages through {@code POST /v1/databases/{id}/query} until {@code has_more} is false.
 * Either every page arrives and the merged result is returned, or the whole fetch fails.
 */
public class NotionUpstreamFetcher implements UpstreamFetcher {

    private static final Logger log = LoggerFactory.getLogger(NotionUpstreamFetcher.class);
    private static final int MAX_ERROR_BODY_LENGTH = 200;

    private final RestClient restClient;
    private final NotionProperties properties;
    private final NotionPageMapper pageMapper;

    public NotionUpstreamFetcher(RestClient restClient, NotionProperties properties, NotionPageMapper pageMapper) {
        this.restClient = restClient;
        this.properties = properties;
        this.pageMapper = pageMapper;
    }

    @Override
    public List<JsonNode> fetchAll(ResourceType type) {
        if (properties.token() == null || properties.token().isBlank()) {
            throw new PermanentFetchException(type, "no API token configured (notion.token)");
        }
        NotionProperties.Database database = properties.database(type)
                .filter(db -> db.id() != null && !db.id().isBlank())
                .orElseThrow(() -> new PermanentFetchException(type,
                        "no database id configured (notion.databases." + type.id() + ".id)"));

        // Keyed by page id: a page shifting between pages mid-pagination is kept once.
        Map<String, JsonNode> records = new LinkedHashMap<>();
        Set<String> seenCursors = new HashSet<>();
        String cursor = null;
        int pages = 0;

        while (true) {
            if (++pages > properties.maxPages()) {
                throw new TransientFetchException(type, "more than " + properties.maxPages() + " pages");
            }
            JsonNode response = queryPage(type, database, cursor);
            JsonNode results = response.path("results");
            if (!results.isArray()) {
                throw new TransientFetchException(type, "response page " + pages + " has no results array");
            }
            for (JsonNode page : results) {
                String id = textOrNull(page.path("id"));
                if (id == null) {
                    throw new TransientFetchException(type, "response page " + pages + " contains a page without id");
                }
                records.putIfAbsent(id, pageMapper.toRecord(type, page));
            }

            if (!response.path("has_more").asBoolean(false)) {
                break;
            }
            cursor = textOrNull(response.path("next_cursor"));
            if (cursor == null) {
                throw new TransientFetchException(type, "has_more without next_cursor on page " + pages);
            }
            if (!seenCursors.add(cursor)) {
                throw new TransientFetchException(type, "cursor " + cursor + " returned twice");
            }
        }

        log.debug("Fetched {} '{}' records in {} page(s)", records.size(), type.id(), pages);
        return new ArrayList<>(records.values());
    }

    private JsonNode queryPage(ResourceType type, NotionProperties.Database database, String cursor) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("page_size", properties.pageSize());
        if (cursor != null) {
            body.put("start_cursor", cursor);
        }
        if (!database.statusFilter().isEmpty()) {
            ArrayNode anyOf = body.putObject("filter").putArray("or");
            for (String status : database.statusFilter()) {
                ObjectNode condition = anyOf.addObject();
                condition.put("property", "Status");
                condition.putObject("status").put("equals", status);
            }
        }

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/databases/{databaseId}/query", database.id())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw classify(type, e);
        } catch (ResourceAccessException e) {
            throw new TransientFetchException(type, "I/O error: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new TransientFetchException(type, "unreadable response: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new TransientFetchException(type, "empty response body");
        }
        return response;
    }

    private UpstreamFetchException classify(ResourceType type, RestClientResponseException e) {
        HttpStatusCode status = e.getStatusCode();
        String detail = "upstream responded " + status.value() + abbreviate(e.getResponseBodyAsString());
        if (status.value() == 429 || status.value() == 408 || status.is5xxServerError()) {
            return new TransientFetchException(type, detail, e);
        }
        return new PermanentFetchException(type, detail, e);
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        return ": " + (body.length() > MAX_ERROR_BODY_LENGTH ? body.substring(0, MAX_ERROR_BODY_LENGTH) + "..." : body);
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() && !node.asText().isEmpty() ? node.asText() : null;
    }
}
