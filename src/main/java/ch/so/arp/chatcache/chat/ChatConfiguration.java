package ch.so.arp.chatcache.chat;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.client.RestClient;

import ch.so.arp.chatcache.cache.DeterministicEmbeddingProvider;
import ch.so.arp.chatcache.cache.EmbeddingProvider;
import ch.so.arp.chatcache.cache.JdbcQueryStore;
import ch.so.arp.chatcache.cache.QueryStore;
import ch.so.arp.chatcache.cache.SemanticCache;
import ch.so.arp.chatcache.cache.SemanticCacheProperties;

/**
 * Central configuration wiring the chat components together. It exposes a toggle
 * that decides whether the mocked or the real language model should be used.
 */
@Configuration
@EnableConfigurationProperties({ OllamaClientProperties.class, SemanticCacheProperties.class })
public class ChatConfiguration {

    @Bean
    @ConditionalOnProperty(name = "chat.mock-llm", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "chat.mock-llm", havingValue = "false")
    public LlmClient ollamaLlmClient(OllamaClientProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getTimeout());
        requestFactory.setReadTimeout(properties.getTimeout());
        RestClient.Builder builder = restClientBuilder.getIfAvailable(RestClient::builder)
                .requestFactory(requestFactory);
        return new OllamaLlmClient(properties, builder);
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingProvider embeddingProvider(SemanticCacheProperties properties) {
        return new DeterministicEmbeddingProvider(properties.getDimensions());
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryStore queryStore(JdbcClient jdbcClient, PlatformTransactionManager transactionManager) {
        return new JdbcQueryStore(jdbcClient, new TransactionTemplate(transactionManager));
    }

    @Bean
    public SemanticCache semanticCache(EmbeddingProvider embeddingProvider, QueryStore queryStore,
            SemanticCacheProperties properties) {
        SemanticCache semanticCache = new SemanticCache(embeddingProvider, queryStore, properties);
        semanticCache.rebuild();
        return semanticCache;
    }
}
