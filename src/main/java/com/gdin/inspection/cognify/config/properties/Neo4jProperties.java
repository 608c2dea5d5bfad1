package com.gdin.inspection.cognify.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.ai.neo4j")
@Component
public class Neo4jProperties implements Serializable {
    private String uri = "bolt://localhost:7687";
    private String username = "neo4j";
    private String password = "password";
    private String database = "neo4j";
}
