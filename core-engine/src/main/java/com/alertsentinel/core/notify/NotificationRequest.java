package com.alertsentinel.core.notify;

import com.alertsentinel.core.model.NotificationChannel;
import com.alertsentinel.core.model.NotificationPriority;
import com.alertsentinel.core.model.RecipientClass;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * Structured notification handed to a {@link NotificationDispatcher}.
 * Rendering and transport are the dispatcher's business.
 *
 * @since 1.0.0
 */
public final class NotificationRequest {

    private final RecipientClass recipientClass;
    private final NotificationPriority priority;
    private final NotificationChannel channel;
    private final String message;
    private final Map<String, String> metadata;

    @JsonCreator
    public NotificationRequest(@JsonProperty("recipientClass") RecipientClass recipientClass,
            @JsonProperty("priority") NotificationPriority priority,
            @JsonProperty("channel") NotificationChannel channel,
            @JsonProperty("message") String message,
            @JsonProperty("metadata") Map<String, String> metadata) {
        this.recipientClass = Objects.requireNonNull(recipientClass, "recipientClass must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.channel = channel != null ? channel : NotificationChannel.EMAIL;
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public RecipientClass getRecipientClass() {
        return recipientClass;
    }

    public NotificationPriority getPriority() {
        return priority;
    }

    public NotificationChannel getChannel() {
        return channel;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NotificationRequest that))
            return false;
        return recipientClass == that.recipientClass
                && priority == that.priority
                && channel == that.channel
                && message.equals(that.message)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recipientClass, priority, channel, message, metadata);
    }

    @Override
    public String toString() {
        return "NotificationRequest{" +
                "recipientClass=" + recipientClass +
                ", priority=" + priority +
                ", channel=" + channel +
                ", message='" + message + '\'' +
                '}';
    }
}
