package xyz.firestige.pipeline.domain.shared.event;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * 领域事件基类
 */
public abstract class DomainEvent {

    private static final DateTimeFormatter DEFAULT_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String eventId;
    private final LocalDateTime timestamp;
    private String message;

    protected DomainEvent() {
        this(UUID.randomUUID().toString(), LocalDateTime.now(), "");
    }

    protected DomainEvent(String eventId, LocalDateTime timestamp, String message) {
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.message = message;
    }

    public String getEventName() {
        return this.getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public String getFormattedTimestamp() {
        return getFormattedTimestamp(DEFAULT_FORMATTER);
    }

    public String getFormattedTimestamp(DateTimeFormatter formatter) {
        Objects.requireNonNull(formatter, "formatter must not be null");
        return timestamp.format(formatter);
    }

    protected void setMessage(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
