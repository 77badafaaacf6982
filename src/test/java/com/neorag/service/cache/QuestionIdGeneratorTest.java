package com.neorag.service.cache;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QuestionIdGenerator.
 */
class QuestionIdGeneratorTest {

    private final QuestionIdGenerator generator = new QuestionIdGenerator();

    @Test
    void testNormalization() {
        assertEquals("what is ml?", QuestionIdGenerator.normalize("  What   is\tML? \n"));
        assertEquals("", QuestionIdGenerator.normalize(null));
    }

    @Test
    void testSameNormalizedQuestionSameId() {
        assertEquals(generator.generate("What is ML?"), generator.generate("what IS   ml?"));
    }

    @Test
    void testIdIsMd5Hex() {
        // md5("abc")
        assertEquals("900150983cd24fb0d6963f7d28e17f72", generator.generate("ABC"));
    }

    @Test
    void testDifferentQuestionsDifferentIds() {
        assertNotEquals(generator.generate("What is ML?"), generator.generate("What is AI?"));
    }
}
