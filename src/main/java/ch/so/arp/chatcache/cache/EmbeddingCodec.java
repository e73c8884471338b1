package ch.so.arp.chatcache.cache;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary representation of embeddings inside the query store: the floats of the
 * vector in little-endian IEEE 754 layout.
 */
final class EmbeddingCodec {

    private EmbeddingCodec() {
    }

    static byte[] encode(float[] embedding) {
        ByteBuffer buffer = ByteBuffer.allocate(embedding.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : embedding) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    static float[] decode(byte[] bytes) {
        if (bytes == null || bytes.length % Float.BYTES != 0) {
            throw new IllegalArgumentException("Embedding blob of "
                    + (bytes == null ? "null" : bytes.length + " bytes") + " is not a float vector");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] embedding = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = buffer.getFloat();
        }
        return embedding;
    }
}
