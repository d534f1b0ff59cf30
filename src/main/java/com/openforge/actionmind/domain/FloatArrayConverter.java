package com.openforge.actionmind.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Stores an embedding vector as a packed little-endian float32 blob
 * (4 bytes per dimension).
 */
@Converter
public class FloatArrayConverter implements AttributeConverter<float[], byte[]> {

    @Override
    public byte[] convertToDatabaseColumn(float[] vector) {
        if (vector == null) return null;
        ByteBuffer buf = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buf.asFloatBuffer().put(vector);
        return buf.array();
    }

    @Override
    public float[] convertToEntityAttribute(byte[] bytes) {
        if (bytes == null) return null;
        if (bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Embedding blob length " + bytes.length + " is not a multiple of 4");
        }
        float[] vector = new float[bytes.length / Float.BYTES];
        ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(vector);
        return vector;
    }
}
