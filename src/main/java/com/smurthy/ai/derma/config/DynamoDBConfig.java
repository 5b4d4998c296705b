package com.smurthy.ai.derma.config;

import com.smurthy.ai.derma.dynamodb.DynamoDBConversationStore;
import com.smurthy.ai.derma.dynamodb.TurnEntity;
import com.smurthy.ai.derma.history.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TimeToLiveSpecification;
import software.amazon.awssdk.services.dynamodb.model.UpdateTimeToLiveRequest;

import java.net.URI;
import java.time.Clock;

/**
 * DynamoDB Configuration for conversation history.
 *
 * This configuration:
 * 1. Connects to DynamoDB Local (Docker) for development, or AWS when no endpoint is set
 * 2. Creates the conversation table if it doesn't exist
 * 3. Configures TTL for auto-expiring old conversations
 * 4. Provides the DynamoDB-backed {@link ConversationStore}
 *
 * Configuration Properties (application.properties):
 * ```
 * derma.history.dynamodb.enabled=true
 * derma.history.dynamodb.endpoint=http://localhost:8000
 * derma.history.dynamodb.table-name=derma_conversations
 * derma.history.dynamodb.ttl-days=30
 * ```
 */
@Configuration
@ConditionalOnProperty(name = "derma.history.dynamodb.enabled", havingValue = "true", matchIfMissing = false)
public class DynamoDBConfig {

    private static final Logger log = LoggerFactory.getLogger(DynamoDBConfig.class);

    @Value("${derma.history.dynamodb.endpoint:http://localhost:8000}")
    private String dynamodbEndpoint;

    @Value("${derma.history.dynamodb.region:ap-south-1}")
    private String region;

    @Value("${derma.history.dynamodb.table-name:derma_conversations}")
    private String tableName;

    @Value("${derma.history.dynamodb.ttl-days:30}")
    private int ttlDays;

    @Bean
    public DynamoDbClient dynamoDbClient() {
        var clientBuilder = DynamoDbClient.builder()
                .region(Region.of(region));

        // DynamoDB Local needs a custom endpoint and accepts any credentials
        if (dynamodbEndpoint != null && !dynamodbEndpoint.isEmpty()) {
            clientBuilder
                    .endpointOverride(URI.create(dynamodbEndpoint))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("fakeAccessKey", "fakeSecretKey")));
            log.info("Configured for DynamoDB Local at {}", dynamodbEndpoint);
        } else {
            log.info("Configured for AWS DynamoDB in region {}", region);
        }
        return clientBuilder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    @Bean
    public ConversationStore dynamoDBConversationStore(DynamoDbEnhancedClient enhancedClient, Clock clock) {
        log.info("Creating DynamoDBConversationStore with table='{}', ttl={}days", tableName, ttlDays);
        return new DynamoDBConversationStore(enhancedClient, tableName, ttlDays, clock);
    }

    /**
     * Creates the table once the context is ready; every bean is initialized by then.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initializeDynamoDBTable(ApplicationReadyEvent event) {
        DynamoDbClient dynamoDbClient = event.getApplicationContext().getBean(DynamoDbClient.class);
        DynamoDbEnhancedClient enhancedClient = event.getApplicationContext().getBean(DynamoDbEnhancedClient.class);
        log.info("Initializing DynamoDB table '{}'", tableName);

        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(DescribeTableRequest.builder()
                    .tableName(tableName)
                    .build());
            log.info("DynamoDB table '{}' already exists with status: {}", tableName, response.table().tableStatus());

        } catch (ResourceNotFoundException e) {
            log.info("Table '{}' does not exist, creating...", tableName);
            enhancedClient.table(tableName, TableSchema.fromBean(TurnEntity.class)).createTable();
            dynamoDbClient.waiter().waitUntilTableExists(DescribeTableRequest.builder()
                    .tableName(tableName)
                    .build());
            log.info("Successfully created DynamoDB table '{}'", tableName);
        }

        if (ttlDays > 0) {
            enableTTL(dynamoDbClient);
        }
    }

    private void enableTTL(DynamoDbClient client) {
        try {
            client.updateTimeToLive(UpdateTimeToLiveRequest.builder()
                    .tableName(tableName)
                    .timeToLiveSpecification(TimeToLiveSpecification.builder()
                            .enabled(true)
                            .attributeName("expirationTime")
                            .build())
                    .build());
            log.info("TTL enabled. Turns will expire after {} days", ttlDays);

        } catch (DynamoDbException e) {
            // Rejected when TTL is already enabled
            log.warn("Could not enable TTL on '{}': {}", tableName, e.getMessage());
        }
    }
}
