package org.lite.toolgateway.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

/**
 * Repositories plus {@code @CreatedDate}/{@code @LastModifiedDate} population.
 * Client and template come from Spring Boot's reactive Mongo auto-configuration
 * ({@code spring.data.mongodb.uri}).
 */
@Configuration
@EnableReactiveMongoRepositories(basePackages = "org.lite.toolgateway.repository")
@EnableReactiveMongoAuditing
public class MongoReactiveConfig {
}
