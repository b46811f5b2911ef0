package com.flamingo.ai.indexer.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.TransportUtils;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import co.elastic.clients.transport.rest5_client.low_level.Rest5ClientBuilder;
import com.google.common.annotations.VisibleForTesting;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Base64;
import javax.net.ssl.SSLContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.ssl.SSLContextBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Elasticsearch client using Apache HttpComponents 5 (ES 9.0+).
 *
 * <p>Supports basic authentication and TLS with a PEM CA bundle, matching a managed cluster
 * reached over HTTPS.
 */
@Configuration
@Slf4j
public class ElasticsearchConfig {

  @Value("${elasticsearch.host:localhost}")
  private String host;

  @Value("${elasticsearch.port:9200}")
  private int port;

  @Value("${elasticsearch.scheme:http}")
  private String scheme;

  @Value("${elasticsearch.username:}")
  private String username;

  @Value("${elasticsearch.password:}")
  private String password;

  @Value("${elasticsearch.ca-certs:}")
  private String caCerts;

  @Value("${elasticsearch.verify-certs:true}")
  private boolean verifyCerts;

  @Bean(destroyMethod = "close")
  public Rest5Client rest5Client() {
    HttpHost httpHost = new HttpHost(scheme, host, port);
    Rest5ClientBuilder builder = Rest5Client.builder(httpHost);

    if (!username.isBlank()) {
      String token =
          Base64.getEncoder()
              .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
      builder.setDefaultHeaders(
          new Header[] {new BasicHeader(HttpHeaders.AUTHORIZATION, "Basic " + token)});
    }

    if ("https".equalsIgnoreCase(scheme)) {
      builder.setSSLContext(buildSslContext());
    }

    log.info("Elasticsearch client configured for {}://{}:{}", scheme, host, port);
    return builder.build();
  }

  @Bean
  public ElasticsearchTransport elasticsearchTransport(Rest5Client rest5Client) {
    return new Rest5ClientTransport(rest5Client, new JacksonJsonpMapper());
  }

  @Bean
  public ElasticsearchClient elasticsearchClient(ElasticsearchTransport transport) {
    return new ElasticsearchClient(transport);
  }

  @VisibleForTesting
  SSLContext buildSslContext() {
    try {
      if (!verifyCerts) {
        log.warn("Certificate verification is disabled for Elasticsearch at {}", host);
        return SSLContextBuilder.create().loadTrustMaterial(TrustAllStrategy.INSTANCE).build();
      }
      if (caCerts.isBlank() || !Files.exists(Path.of(caCerts))) {
        log.debug("No CA bundle configured, using the JVM trust store");
        return SSLContext.getDefault();
      }
      log.debug("Trusting CA certificate from {}", caCerts);
      return TransportUtils.sslContextFromHttpCaCrt(new File(caCerts));
    } catch (GeneralSecurityException | IOException e) {
      throw new IllegalStateException("Failed to build SSL context for Elasticsearch", e);
    }
  }
}
