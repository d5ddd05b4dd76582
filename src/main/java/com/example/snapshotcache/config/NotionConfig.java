package com.example.snapshotcache.config;

import com.example.snapshotcache.fetch.NotionPageMapper;
import com.example.snapshotcache.fetch.NotionUpstreamFetcher;
import com.example.snapshotcache.fetch.UpstreamFetcher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class NotionConfig {

    static final String NOTION_VERSION_HEADER = "Notion-Version";

    @Bean
    public NotionPageMapper notionPageMapper() {
        return new NotionPageMapper();
    }

    @Bean
    public UpstreamFetcher notionUpstreamFetcher(RestClient.Builder restClientBuilder, NotionProperties properties,
                                                 NotionPageMapper pageMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) properties.connectTimeout().toMillis());
        requestFactory.setReadTimeout((int) properties.readTimeout().toMillis());

        RestClient restClient = restClientBuilder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(NOTION_VERSION_HEADER, properties.version())
                .defaultHeaders(headers -> {
                    if (properties.token() != null && !properties.token().isBlank()) {
                        headers.setBearerAuth(properties.token());
                    }
                })
                .build();
        return new NotionUpstreamFetcher(restClient, properties, pageMapper);
    }
}
