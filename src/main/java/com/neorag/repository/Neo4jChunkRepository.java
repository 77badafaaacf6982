package com.neorag.repository;

import com.neorag.config.NeoragProperties;
import com.neorag.exception.ConnectivityException;
import com.neorag.exception.RetrievalException;
import com.neorag.model.ChunkNeighborhood;
import com.neorag.model.ChunkResult;
import com.neorag.service.retrieval.ChunkGraph;
import com.neorag.service.retrieval.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chunk lookups against Neo4j: the vector index over (:Chunk).embedding and the
 * (:Chunk)-[:NEXT]->(:Chunk) / (:Document)-[:HAS_CHUNK]->(:Chunk) structure.
 * Index and schema provisioning happen elsewhere.
 */
@Slf4j
@Repository
public class Neo4jChunkRepository implements VectorIndex, ChunkGraph {

    private static final String BACKEND = "neo4j";

    private static final String VECTOR_QUERY = """
            CALL db.index.vector.queryNodes($indexName, $k, $embedding)
            YIELD node, score
            RETURN node.id AS chunk_id, node.text AS text, score
            """;

    private static final String NEIGHBOR_QUERY = """
            MATCH (c:Chunk {id: $chunkId})
            OPTIONAL MATCH (prev:Chunk)-[:NEXT]->(c)
            OPTIONAL MATCH (c)-[:NEXT]->(next:Chunk)
            OPTIONAL MATCH (d:Document)-[:HAS_CHUNK]->(c)
            RETURN c.text AS current, c.position AS position,
                   prev.text AS previous, next.text AS next,
                   d.title AS document_title, d.id AS document_id
            LIMIT 1
            """;

    private final Driver driver;
    private final NeoragProperties.Neo4jConfig config;

    public Neo4jChunkRepository(Driver driver, NeoragProperties properties) {
        this.driver = driver;
        this.config = properties.getNeo4j();
    }

    @Override
    public List<ChunkResult> query(float[] embedding, int k) {
        List<Double> vector = new ArrayList<>(embedding.length);
        for (float value : embedding) {
            vector.add((double) value);
        }

        try (Session session = driver.session(SessionConfig.forDatabase(config.getDatabase()))) {
            List<ChunkResult> results = session.executeRead(tx -> tx.run(VECTOR_QUERY, Values.parameters(
                            "indexName", config.getVectorIndexName(),
                            "k", k,
                            "embedding", vector))
                    .list(Neo4jChunkRepository::toChunkResult));
            log.debug("Vector index returned {} chunks (k={})", results.size(), k);
            return results;
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            throw new ConnectivityException(BACKEND, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new RetrievalException("Vector index query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<ChunkNeighborhood> neighbors(String chunkId) {
        try (Session session = driver.session(SessionConfig.forDatabase(config.getDatabase()))) {
            List<ChunkNeighborhood> rows = session.executeRead(tx -> tx.run(NEIGHBOR_QUERY,
                            Values.parameters("chunkId", chunkId))
                    .list(record -> toNeighborhood(chunkId, record)));
            return rows.stream().findFirst();
        } catch (ServiceUnavailableException | SessionExpiredException e) {
            throw new ConnectivityException(BACKEND, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new RetrievalException("Neighbour lookup failed for chunk " + chunkId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            driver.verifyConnectivity();
            return true;
        } catch (Exception e) {
            log.warn("Neo4j not reachable at {}: {}", config.getUri(), e.getMessage());
            return false;
        }
    }

    private static ChunkResult toChunkResult(Record record) {
        return ChunkResult.builder()
                .chunkId(string(record.get("chunk_id")))
                .text(string(record.get("text")))
                .score(record.get("score").asDouble())
                .build();
    }

    private static ChunkNeighborhood toNeighborhood(String chunkId, Record record) {
        Value position = record.get("position");
        return ChunkNeighborhood.builder()
                .chunkId(chunkId)
                .current(string(record.get("current")))
                .position(position.isNull() ? null : position.asLong())
                .previous(string(record.get("previous")))
                .next(string(record.get("next")))
                .documentTitle(string(record.get("document_title")))
                .documentId(string(record.get("document_id")))
                .build();
    }

    private static String string(Value value) {
        return value == null || value.isNull() ? null : value.asString();
    }
}
