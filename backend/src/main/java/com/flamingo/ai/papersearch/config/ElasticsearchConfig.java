package com.flamingo.ai.papersearch.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch client for the chunk store, over the HttpComponents 5 transport of ES 9.
 *
 * <p>Only loaded with {@code rag.vector-store.type=elasticsearch}. Secured clusters are reached
 * with an API key sent on every request.
 */
@Configuration
@ConditionalOnProperty(name = "rag.vector-store.type", havingValue = "elasticsearch")
@Slf4j
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.api-key:}")
  private String apiKey;

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client() {
    Rest5ClientBuilder builder = Rest5Client.builder(new HttpHost(scheme, host, port));
    if (!apiKey.isBlank()) {
      Header auth = new BasicHeader("Authorization", "ApiKey " + apiKey);
      builder.setDefaultHeaders(new Header[] {auth});
    }
    log.info(
        "Chunk store uses Elasticsearch at {}://{}:{}{}",
        scheme,
        host,
        port,
        apiKey.isBlank() ? "" : " with API key");
    return builder.build();
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(Rest5Client rest5Client) {
    ElasticsearchTransport transport =
        new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper());
    return new ElasticsearchClient(transport);
  }
}
