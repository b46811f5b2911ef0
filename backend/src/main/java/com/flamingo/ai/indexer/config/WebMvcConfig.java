package com.flamingo.ai.indexer.config;

import com.flamingo.ai.indexer.api.rest.RequestLimitInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration for limiting concurrent index requests. */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final IndexerConfig indexerConfig;

  /** Creates the interceptor guarding {@code /index}; one permit covers a whole batch. */
  @Bean
  public RequestLimitInterceptor requestLimitInterceptor() {
    return new RequestLimitInterceptor(indexerConfig.getConcurrentRequestLimit());
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestLimitInterceptor()).addPathPatterns("/index");
  }
}
