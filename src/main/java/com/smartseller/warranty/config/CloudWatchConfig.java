package com.smartseller.warranty.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.time.Duration;

/**
 * Ships the warranty.* meters to CloudWatch.
 * Enabled with cloud.aws.cloudwatch.enabled=true; otherwise the actuator's default registry is used.
 * Every meter carries a service tag so batch, claim and public metrics of several deployments
 * can share one namespace.
 *
 * @author Warranty Platform Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    @Value("${cloud.aws.region:us-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:WarrantyService}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private int batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private Duration step;

    @Value("${spring.application.name:warranty-service}")
    private String serviceName;

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        CloudWatchMeterRegistry registry =
                new CloudWatchMeterRegistry(registryConfig(), Clock.SYSTEM, cloudWatchAsyncClient);
        registry.config().commonTags("service", serviceName);
        return registry;
    }

    private io.micrometer.cloudwatch2.CloudWatchConfig registryConfig() {
        return new io.micrometer.cloudwatch2.CloudWatchConfig() {
            @Override
            public String get(String key) {
                return null;
            }

            @Override
            public String namespace() {
                return namespace;
            }

            @Override
            public int batchSize() {
                return batchSize;
            }

            @Override
            public Duration step() {
                return step;
            }
        };
    }
}
