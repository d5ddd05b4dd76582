package com.example.snapshotcache.config;

import com.example.snapshotcache.model.ResourceType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Upstream API access. A missing token or database id is not a startup error:
 * fetches for the affected type fail permanently until the configuration is fixed.
 *
 * <pre>{@code
 * notion:
 *   token: ${NOTION_API_KEY}
 *   databases:
 *     projects:
 *       id: 1c33b84f1fac80e78028e7d1713b96d1
 *     todos:
 *       id: 1c33b84f1fac8055a0f3e192311652ab
 *       status-filter: [To-do, In-progress]
 * }</pre>
 */
@ConfigurationProperties(prefix = "notion")
public record NotionProperties(
        @DefaultValue("https://api.notion.com") String baseUrl,
        String token,
        @DefaultValue("2022-06-28") String version,
        @DefaultValue("100") int pageSize,
        @DefaultValue("1000") int maxPages,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("30s") Duration readTimeout,
        Map<ResourceType, Database> databases) {

    /** Notion caps {@code page_size} at 100. */
    public static final int MAX_PAGE_SIZE = 100;

    public NotionProperties {
        if (pageSize <= 0 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException(
                    "notion.page-size must be between 1 and " + MAX_PAGE_SIZE + ", got: " + pageSize);
        }
        if (maxPages <= 0) {
            throw new IllegalArgumentException("notion.max-pages must be positive, got: " + maxPages);
        }
        databases = databases == null ? Map.of() : Map.copyOf(databases);
    }

    public Optional<Database> database(ResourceType type) {
        return Optional.ofNullable(databases.get(type));
    }

    /**
     * @param statusFilter when non-empty, only pages whose {@code Status} equals one of these are fetched
     */
    public record Database(String id, List<String> statusFilter) {

        public Database {
            statusFilter = statusFilter == null ? List.of() : List.copyOf(statusFilter);
        }
    }
}
