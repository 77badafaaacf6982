package com.neorag.config;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Neo4j driver for the chunk graph and its vector index.
 */
@Slf4j
@Configuration
public class Neo4jConfiguration {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(NeoragProperties properties) {
        NeoragProperties.Neo4jConfig neo4j = properties.getNeo4j();
        log.info("Configured Neo4j driver for {} (database={})", neo4j.getUri(), neo4j.getDatabase());
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()));
    }
}
