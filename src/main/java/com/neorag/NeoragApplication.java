package com.neorag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for neorag - question answering over a Neo4j chunk graph
 * with a semantic query cache in front of retrieval and generation.
 */
@SpringBootApplication
public class NeoragApplication {

    public static void main(String[] args) {
        SpringApplication.run(NeoragApplication.class, args);
    }
}
