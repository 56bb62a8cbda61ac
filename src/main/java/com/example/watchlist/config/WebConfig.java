package com.example.watchlist.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {
  @Value("${app.cors.allowed-origin:*}")
  private String allowedOrigin;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    String[] origins = "*".equals(allowedOrigin)
        ? new String[]{"*"}
        : new String[]{"https://" + allowedOrigin, "http://" + allowedOrigin};
    registry.addMapping("/**")
        .allowedOrigins(origins)
        .allowedMethods("GET")
        .allowedHeaders("*")
        .maxAge(3600);
  }
}
