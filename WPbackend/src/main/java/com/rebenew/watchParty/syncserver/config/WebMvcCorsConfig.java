package com.rebenew.watchParty.syncserver.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcCorsConfig {
    @Bean
    public WebMvcConfigurer corsConfigurer(WatchPartyProperties properties) {
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                // la API HTTP es de solo lectura
                registry.addMapping("/rooms/**")
                        .allowedOrigins(properties.getCors().getAllowedOrigins().toArray(new String[0]))
                        .allowedMethods("GET", "OPTIONS")
                        .allowedHeaders("*")
                        .maxAge(3600);
            }
        };
    }
}
