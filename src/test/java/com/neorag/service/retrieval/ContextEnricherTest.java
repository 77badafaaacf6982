package com.neorag.service.retrieval;

import com.neorag.model.ChunkNeighborhood;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ContextEnricher.
 */
class ContextEnricherTest {

    @Test
    void testMiddleChunkHasAllThreeBlocks() {
        ChunkNeighborhood neighborhood = ChunkNeighborhood.builder()
                .previous("Before.")
                .current("Middle.")
                .next("After.")
                .build();

        assertEquals("[Previous]: Before.\n\n[Main]: Middle.\n\n[Next]: After.",
                ContextEnricher.enrich(neighborhood));
    }

    @Test
    void testFirstChunkHasNoPreviousBlock() {
        ChunkNeighborhood neighborhood = ChunkNeighborhood.builder()
                .current("Opening paragraph.")
                .next("Second paragraph.")
                .build();

        String enriched = ContextEnricher.enrich(neighborhood);

        assertFalse(enriched.contains("[Previous]"));
        assertTrue(enriched.startsWith("[Main]: Opening paragraph."));
    }

    @Test
    void testLoneChunkIsMainOnly() {
        ChunkNeighborhood neighborhood = ChunkNeighborhood.builder().current("Only.").build();

        assertEquals("[Main]: Only.", ContextEnricher.enrich(neighborhood));
    }
}
