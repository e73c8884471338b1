package ch.so.arp.chatcache.chat;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Simple configuration properties describing how to connect to Ollama.
 */
@ConfigurationProperties(prefix = "chat.ollama")
public class OllamaClientProperties {

    /**
     * Base URL of the Ollama server.
     */
    private String baseUrl = "http://localhost:11434";

    /**
     * Name of the model that should answer.
     */
    private String model = "llama3.2";

    /**
     * Upper bound for connecting to and reading from the server.
     */
    private Duration timeout = Duration.ofMinutes(2);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
