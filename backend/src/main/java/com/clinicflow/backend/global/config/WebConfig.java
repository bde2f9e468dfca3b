package com.clinicflow.backend.global.config;

import com.clinicflow.backend.global.ratelimit.BookingRateLimitInterceptor;
import com.clinicflow.backend.global.ratelimit.RateLimitProperties;
import com.clinicflow.backend.global.ratelimit.SharedCounter;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(value = "app.rate-limit.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RateLimitProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private final SharedCounter sharedCounter;
    private final RateLimitProperties rateLimitProperties;

    public WebConfig(SharedCounter sharedCounter, RateLimitProperties rateLimitProperties) {
        this.sharedCounter = sharedCounter;
        this.rateLimitProperties = rateLimitProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new BookingRateLimitInterceptor(sharedCounter, rateLimitProperties))
                .addPathPatterns("/appointments", "/appointments/**");
    }
}
