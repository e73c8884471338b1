package ch.so.arp.chatcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatCacheApplication.class, args);
    }
}
