package ch.so.arp.chatcache.chat;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.chatcache.cache.SemanticCache;

/**
 * Exposes the size of the in-memory cache index.
 */
@RestController
public class CacheStatsController {

    private final SemanticCache semanticCache;

    public CacheStatsController(SemanticCache semanticCache) {
        this.semanticCache = semanticCache;
    }

    @GetMapping(path = "/api/cache/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public CacheStats stats() {
        return new CacheStats(semanticCache.size());
    }

    public record CacheStats(int indexSize) {
    }
}
