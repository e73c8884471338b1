package ch.so.arp.chatcache.chat;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Persists conversation threads and their transcripts in the {@code chats} and
 * {@code messages} tables. Deleting a chat removes its messages as well.
 */
@Repository
public class ChatRepository {

    private final JdbcClient jdbcClient;

    public ChatRepository(JdbcClient jdbcClient) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
    }

    public ChatSession create(String title) {
        String id = UUID.randomUUID().toString();
        jdbcClient.sql("INSERT INTO chats (id, title) VALUES (:id, :title)")
                .param("id", id)
                .param("title", title)
                .update();
        return findById(id).orElseThrow(() -> new IllegalStateException("Chat " + id + " was not created"));
    }

    public List<ChatSession> findAll() {
        return jdbcClient.sql("SELECT id, title, created_at FROM chats ORDER BY created_at DESC, id")
                .query(this::mapChat)
                .list();
    }

    public Optional<ChatSession> findById(String id) {
        return jdbcClient.sql("SELECT id, title, created_at FROM chats WHERE id = :id")
                .param("id", id)
                .query(this::mapChat)
                .optional();
    }

    public boolean exists(String id) {
        return jdbcClient.sql("SELECT COUNT(*) FROM chats WHERE id = :id")
                .param("id", id)
                .query(Long.class)
                .single() > 0;
    }

    public List<ChatMessage> findMessages(String chatId) {
        return jdbcClient.sql("SELECT role, content FROM messages WHERE chat_id = :chatId ORDER BY id")
                .param("chatId", chatId)
                .query((rs, rowNum) -> new ChatMessage(rs.getString("role"), rs.getString("content")))
                .list();
    }

    public void saveMessage(String chatId, String role, String content) {
        jdbcClient.sql("INSERT INTO messages (chat_id, role, content) VALUES (:chatId, :role, :content)")
                .param("chatId", chatId)
                .param("role", role)
                .param("content", content)
                .update();
    }

    public boolean updateTitle(String id, String title) {
        return jdbcClient.sql("UPDATE chats SET title = :title WHERE id = :id")
                .param("id", id)
                .param("title", title)
                .update() > 0;
    }

    public boolean delete(String id) {
        return jdbcClient.sql("DELETE FROM chats WHERE id = :id")
                .param("id", id)
                .update() > 0;
    }

    public int deleteAll() {
        return jdbcClient.sql("DELETE FROM chats").update();
    }

    private ChatSession mapChat(ResultSet rs, int rowNum) throws SQLException {
        String id = rs.getString("id");
        Instant createdAt = rs.getTimestamp("created_at").toInstant();
        return new ChatSession(id, rs.getString("title"), createdAt, findMessages(id));
    }
}
