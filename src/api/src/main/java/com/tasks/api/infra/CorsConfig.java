package com.tasks.api.infra;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Answers browser preflight requests for the task routes from any origin.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    for (String pattern : new String[] {"/tasks", "/tasks/**"}) {
      registry.addMapping(pattern)
          .allowedOrigins("*")
          .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
          .allowedHeaders("Content-Type", RequestIdFilter.REQ_ID_HEADER)
          .exposedHeaders(RequestIdFilter.REQ_ID_HEADER)
          .maxAge(3600);
    }
  }
}
