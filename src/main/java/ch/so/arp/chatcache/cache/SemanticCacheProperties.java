package ch.so.arp.chatcache.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning parameters of the semantic response cache.
 */
@ConfigurationProperties(prefix = "chat.cache")
public class SemanticCacheProperties {

    /**
     * Similarity a fast-path candidate must exceed to take part in the vote.
     */
    private double highThreshold = 0.75d;

    /**
     * Similarity a stored question must exceed to be accepted by the store scan.
     * Must not be greater than the high threshold.
     */
    private double lowThreshold = 0.60d;

    /**
     * Number of nearest neighbours considered on the fast path.
     */
    private int topK = 5;

    /**
     * Width of the embedding vectors.
     */
    private int dimensions = 384;

    public double getHighThreshold() {
        return highThreshold;
    }

    public void setHighThreshold(double highThreshold) {
        this.highThreshold = highThreshold;
    }

    public double getLowThreshold() {
        return lowThreshold;
    }

    public void setLowThreshold(double lowThreshold) {
        this.lowThreshold = lowThreshold;
    }

    public int getTopK() {
        return topK;
    }

    public void setTopK(int topK) {
        this.topK = topK;
    }

    public int getDimensions() {
        return dimensions;
    }

    public void setDimensions(int dimensions) {
        this.dimensions = dimensions;
    }
}
