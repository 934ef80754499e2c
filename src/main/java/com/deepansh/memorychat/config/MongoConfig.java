package com.deepansh.memorychat.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Auditing fills @CreatedDate on memories and traces.
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = {
    "com.deepansh.memorychat.memory",
    "com.deepansh.memorychat.observability"
})
public class MongoConfig {
}
