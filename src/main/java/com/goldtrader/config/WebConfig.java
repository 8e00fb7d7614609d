package com.goldtrader.config;

import com.goldtrader.api.controller.TradingController;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Browser access to the trading API. The UI only ever reads and posts; the user header must pass preflight. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${goldtrader.cors.allowed-origin}")
    private String allowedOrigin;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(allowedOrigin)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("Content-Type", TradingController.USER_HEADER)
                .maxAge(3600);
    }
}
