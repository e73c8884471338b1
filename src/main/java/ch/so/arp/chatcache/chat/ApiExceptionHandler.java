package ch.so.arp.chatcache.chat;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import ch.so.arp.chatcache.cache.EmbeddingFailureException;
import ch.so.arp.chatcache.cache.SemanticCacheException;

/**
 * Renders failures as RFC 7807 problem details.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.put(error.getField(), error.getDefaultMessage());
        }
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation_failed", "Request validation failed");
        problem.setProperty("fields", fields);
        LOGGER.info("Rejected invalid request, fields {}", fields.keySet());
        return problem;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleBadJson(HttpMessageNotReadableException ex) {
        LOGGER.info("Rejected malformed request body");
        return problem(HttpStatus.BAD_REQUEST, "malformed_json", "Malformed JSON request body");
    }

    @ExceptionHandler(ChatNotFoundException.class)
    public ProblemDetail handleChatNotFound(ChatNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "chat_not_found", ex.getMessage());
    }

    @ExceptionHandler(GenerationException.class)
    public ProblemDetail handleGeneration(GenerationException ex) {
        HttpStatus status = ex.getKind() == GenerationException.Kind.SERVICE_UNAVAILABLE
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_GATEWAY;
        LOGGER.warn("Language model failed ({}): {}", ex.getKind(), ex.getMessage());
        return problem(status, "generation_failed", ex.getMessage());
    }

    @ExceptionHandler(EmbeddingFailureException.class)
    public ProblemDetail handleEmbedding(EmbeddingFailureException ex) {
        LOGGER.warn("Embedding failed: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "embedding_failed", ex.getMessage());
    }

    @ExceptionHandler(SemanticCacheException.class)
    public ProblemDetail handleCache(SemanticCacheException ex) {
        LOGGER.error("Semantic cache failed", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "cache_failed", ex.getMessage());
    }

    /**
     * Spring MVC failures such as an unsupported content type, a wrong HTTP method or
     * an unknown path already carry their status and problem body.
     */
    @ExceptionHandler({ ErrorResponseException.class, HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class, HttpRequestMethodNotSupportedException.class,
            NoResourceFoundException.class })
    public ResponseEntity<ProblemDetail> handleSpringErrorResponse(Exception ex) {
        ErrorResponse errorResponse = (ErrorResponse) ex;
        LOGGER.info("Rejected request with status {}: {}", errorResponse.getStatusCode().value(), ex.getMessage());
        return ResponseEntity.status(errorResponse.getStatusCode())
                .headers(errorResponse.getHeaders())
                .body(errorResponse.getBody());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        LOGGER.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected server error");
    }

    private ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
