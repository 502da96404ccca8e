package com.company.alerting.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * Provider clients for the EMAIL, SMS, QUEUE and FUNCTION channels.
 * Credentials come from the default provider chain.
 */
@Configuration
public class AwsClientConfig {

    @Bean(destroyMethod = "close")
    public SesV2Client sesV2Client(AlertingProperties properties) {
        return SesV2Client.builder().region(region(properties)).build();
    }

    @Bean(destroyMethod = "close")
    public SnsClient snsClient(AlertingProperties properties) {
        return SnsClient.builder().region(region(properties)).build();
    }

    @Bean(destroyMethod = "close")
    public SqsClient sqsClient(AlertingProperties properties) {
        return SqsClient.builder().region(region(properties)).build();
    }

    @Bean(destroyMethod = "close")
    public LambdaClient lambdaClient(AlertingProperties properties) {
        return LambdaClient.builder().region(region(properties)).build();
    }

    private Region region(AlertingProperties properties) {
        return Region.of(properties.getAws().getRegion());
    }
}
