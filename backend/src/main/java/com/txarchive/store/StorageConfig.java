package com.txarchive.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Selects the archive backend from {@code txarchive.storage.backend}. The Mongo client is only created
 * for the mongo backend, so the default file backend runs without a database.
 */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(prefix = "txarchive.storage", name = "backend", havingValue = "file", matchIfMissing = true)
    public TransactionStore fileTransactionStore(StorageProperties properties, ObjectMapper objectMapper, Clock clock) {
        return new FileTransactionStore(Path.of(properties.getPath()), objectMapper, clock);
    }

    @Configuration
    @ConditionalOnProperty(prefix = "txarchive.storage", name = "backend", havingValue = "mongo")
    static class MongoStorageConfig {

        @Bean(destroyMethod = "close")
        public MongoClient archiveMongoClient(StorageProperties properties) {
            return MongoClients.create(properties.getMongo().getUri());
        }

        @Bean
        public MongoTemplate archiveMongoTemplate(MongoClient archiveMongoClient, StorageProperties properties) {
            return new MongoTemplate(archiveMongoClient, properties.getMongo().getDatabase());
        }

        @Bean
        public TransactionStore mongoTransactionStore(MongoTemplate archiveMongoTemplate, Clock clock) {
            return new MongoTransactionStore(archiveMongoTemplate, clock);
        }
    }
}
