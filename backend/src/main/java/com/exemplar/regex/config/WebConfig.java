package com.exemplar.regex.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.ViewControllerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  private static final String[] ALLOWED_METHODS = {"GET", "POST", "OPTIONS"};
  private static final String[] EXPOSED_HEADERS = {"X-Correlation-Id"};

  @Value("${cors.allowed-origins:}")
  private String[] allowedOrigins;

  @Override
  public void addViewControllers(ViewControllerRegistry registry) {
    registry.addRedirectViewController("/", "/swagger-ui/index.html");
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    String[] origins =
        allowedOrigins == null || allowedOrigins.length == 0 ? new String[] {"*"} : allowedOrigins;
    registry
        .addMapping("/api/**")
        .allowedOriginPatterns(origins)
        .allowedMethods(ALLOWED_METHODS)
        .allowedHeaders("*")
        .exposedHeaders(EXPOSED_HEADERS);
  }
}
