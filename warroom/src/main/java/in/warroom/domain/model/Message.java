package in.warroom.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * One line in the war room transcript.
 *
 * Immutable: created by the triage orchestrator and never touched after publish.
 */
public record Message(
    @JsonProperty("agent")
    String agent,

    @JsonProperty("text")
    String text,

    @JsonProperty("timestamp")
    String timestamp,              // HH:mm:ss, wall clock of the speaker

    @JsonProperty("message_type")
    MessageType type
) {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("HH:mm:ss");

    public Message {
        Objects.requireNonNull(agent, "agent");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Create a message stamped with the current time of the given clock.
     */
    public static Message at(Clock clock, String agent, String text, MessageType type) {
        return new Message(agent, text, LocalTime.now(clock).format(TIMESTAMP), type);
    }

    public static Message speech(Clock clock, String agent, String text) {
        return at(clock, agent, text, MessageType.SPEECH);
    }
}
