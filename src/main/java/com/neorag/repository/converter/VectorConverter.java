package com.neorag.repository.converter;

import com.neorag.exception.CacheSerializationException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Converts embeddings to and from the raw bytes kept in the cache store:
 * little-endian IEEE-754 float32, four bytes per dimension, no header.
 */
public final class VectorConverter {

    private VectorConverter() {
    }

    public static byte[] toBytes(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float v : vector) {
            buffer.putFloat(v);
        }
        return buffer.array();
    }

    public static float[] fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new CacheSerializationException("Empty embedding record");
        }
        if (bytes.length % Float.BYTES != 0) {
            throw new CacheSerializationException(
                    "Embedding record length " + bytes.length + " is not a multiple of " + Float.BYTES);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }
}
