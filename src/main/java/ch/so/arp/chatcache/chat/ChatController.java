package ch.so.arp.chatcache.chat;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint for managing chats and asking questions inside them.
 */
@RestController
@RequestMapping(path = "/api/chats", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ChatSession create() {
        return chatService.startChat();
    }

    @GetMapping
    public List<ChatSession> list() {
        return chatService.listChats();
    }

    @GetMapping("/{chatId}")
    public ChatSession get(@PathVariable String chatId) {
        return chatService.findChat(chatId).orElseThrow(() -> new ChatNotFoundException(chatId));
    }

    @DeleteMapping("/{chatId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String chatId) {
        chatService.deleteChat(chatId);
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteAll() {
        chatService.deleteAllChats();
    }

    @PutMapping(path = "/{chatId}/title", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void rename(@PathVariable String chatId, @Valid @RequestBody TitleRequest request) {
        chatService.renameChat(chatId, request.title());
    }

    @PostMapping(path = "/{chatId}/messages", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ChatAnswer ask(@PathVariable String chatId, @Valid @RequestBody ChatRequest request) {
        return chatService.ask(chatId, request.question(), request.temperature());
    }
}
