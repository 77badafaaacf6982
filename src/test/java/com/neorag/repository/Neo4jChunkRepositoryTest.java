package com.neorag.repository;

import com.neorag.config.NeoragProperties;
import com.neorag.exception.ConnectivityException;
import com.neorag.exception.RetrievalException;
import com.neorag.model.ChunkResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionCallback;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for Neo4jChunkRepository.
 */
class Neo4jChunkRepositoryTest {

    private Driver driver;
    private Session session;
    private Neo4jChunkRepository repository;

    @BeforeEach
    void setUp() {
        driver = mock(Driver.class);
        session = mock(Session.class);
        when(driver.session(any(SessionConfig.class))).thenReturn(session);
        repository = new Neo4jChunkRepository(driver, new NeoragProperties());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testQueryKeepsIndexOrder() {
        TransactionContext tx = mock(TransactionContext.class);
        Result result = mock(Result.class);
        List<Record> records = List.of(record("c2", 0.9), record("c1", 0.9), record("c3", 0.95));
        ArgumentCaptor<String> cypher = ArgumentCaptor.forClass(String.class);

        when(tx.run(cypher.capture(), any(Value.class))).thenReturn(result);
        when(result.list(any(Function.class))).thenAnswer(invocation -> {
            Function<Record, ChunkResult> mapper = invocation.getArgument(0);
            List<ChunkResult> mapped = new ArrayList<>();
            for (Record record : records) {
                mapped.add(mapper.apply(record));
            }
            return mapped;
        });
        when(session.executeRead(any())).thenAnswer(invocation ->
                invocation.getArgument(0, TransactionCallback.class).execute(tx));

        List<ChunkResult> chunks = repository.query(new float[]{0.1f, 0.2f}, 3);

        assertThat(chunks).extracting(ChunkResult::getChunkId).containsExactly("c2", "c1", "c3");
        assertThat(cypher.getValue()).contains("db.index.vector.queryNodes").doesNotContain("ORDER BY");
    }

    @Test
    void testUnreachableDatabaseIsConnectivityFailure() {
        when(session.executeRead(any())).thenThrow(new ServiceUnavailableException("connection refused"));

        assertThatThrownBy(() -> repository.query(new float[]{0.1f}, 3))
                .isInstanceOf(ConnectivityException.class);
        verify(session).close();
    }

    @Test
    void testQueryErrorIsRetrievalFailure() {
        when(session.executeRead(any())).thenThrow(new ClientException("There is no such vector schema index"));

        assertThatThrownBy(() -> repository.query(new float[]{0.1f}, 3))
                .isInstanceOf(RetrievalException.class)
                .hasMessageContaining("Vector index query failed");
    }

    @Test
    void testNeighbourLookupErrorIsRetrievalFailure() {
        when(session.executeRead(any())).thenThrow(new ClientException("syntax error"));

        assertThatThrownBy(() -> repository.neighbors("c1"))
                .isInstanceOf(RetrievalException.class)
                .hasMessageContaining("c1");
    }

    @Test
    void testAvailabilityProbe() {
        assertThat(repository.isAvailable()).isTrue();

        doThrow(new ServiceUnavailableException("down")).when(driver).verifyConnectivity();

        assertThat(repository.isAvailable()).isFalse();
    }

    private static Record record(String chunkId, double score) {
        Record record = mock(Record.class);
        when(record.get("chunk_id")).thenReturn(Values.value(chunkId));
        when(record.get("text")).thenReturn(Values.value("text of " + chunkId));
        when(record.get("score")).thenReturn(Values.value(score));
        return record;
    }
}
