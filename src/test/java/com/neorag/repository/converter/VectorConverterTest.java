package com.neorag.repository.converter;

import com.neorag.exception.CacheSerializationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VectorConverter.
 */
class VectorConverterTest {

    @Test
    void testLittleEndianFloat32Layout() {
        byte[] bytes = VectorConverter.toBytes(new float[]{1.0f, -2.0f});

        // 1.0f = 0x3F800000, -2.0f = 0xC0000000, least significant byte first
        assertArrayEquals(new byte[]{0, 0, (byte) 0x80, 0x3F, 0, 0, 0, (byte) 0xC0}, bytes);
    }

    @Test
    void testDecodesWhatItEncodes() {
        float[] vector = {0.125f, -3.5f, 1e-7f, Float.MAX_VALUE};
        assertArrayEquals(vector, VectorConverter.fromBytes(VectorConverter.toBytes(vector)));
    }

    @Test
    void testRejectsTruncatedRecord() {
        assertThrows(CacheSerializationException.class, () -> VectorConverter.fromBytes(new byte[]{1, 2, 3, 4, 5}));
    }

    @Test
    void testRejectsEmptyRecord() {
        assertThrows(CacheSerializationException.class, () -> VectorConverter.fromBytes(new byte[0]));
        assertThrows(CacheSerializationException.class, () -> VectorConverter.fromBytes(null));
    }
}
