package ch.so.arp.chatcache.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class EmbeddingCodecTest {

    @Test
    void writesFourLittleEndianBytesPerDimension() {
        byte[] bytes = EmbeddingCodec.encode(new float[] { 1.0f, -0.5f });

        assertThat(bytes).hasSize(8);
        // 1.0f is 0x3F800000
        assertThat(bytes).startsWith((byte) 0x00, (byte) 0x00, (byte) 0x80, (byte) 0x3F);
        assertThat(EmbeddingCodec.decode(bytes)).containsExactly(1.0f, -0.5f);
    }

    @Test
    void rejectsTruncatedBlobs() {
        assertThatThrownBy(() -> EmbeddingCodec.decode(new byte[] { 1, 2, 3 }))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EmbeddingCodec.decode(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
