package com.pharmafinder.matcher.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

import java.time.Duration;

@Configuration
public class BedrockClientConfiguration {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${app.bedrock.apiCallTimeoutMs:5000}")
    private long apiCallTimeoutMs;

    @Bean(destroyMethod = "close")
    public BedrockRuntimeClient bedrockRuntimeClient() {
        return BedrockRuntimeClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .retryPolicy(RetryPolicy.none()) // throttling retries happen in BedrockModelGateway
                        .apiCallTimeout(Duration.ofMillis(Math.max(100, apiCallTimeoutMs)))
                        .build())
                .build();
    }
}
