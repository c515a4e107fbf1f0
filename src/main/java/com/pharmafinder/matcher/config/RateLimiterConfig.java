package com.pharmafinder.matcher.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.ratelimit.chatQps:0}")
    private double chatRateLimit;
    @Value("${app.ratelimit.embedQps:0}")
    private double embedRateLimit;

    @Bean("chatRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter chatRateLimiter() {
        return createOptionalLimiter(chatRateLimit);
    }

    @Bean("embedRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter embedRateLimiter() {
        return createOptionalLimiter(embedRateLimit);
    }

    // qps <= 0 means unthrottled
    private RateLimiter createOptionalLimiter(double qps) {
        double effectiveQps = qps > 0 ? qps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
