package in.warroom.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a war room message, as rendered by the stream clients.
 */
public enum MessageType {
    SPEECH,
    CODE,
    HUMAN,
    APPROVAL_REQUEST,
    RCA,
    CONTROL;

    /**
     * Wire name (lowercase, e.g. "approval_request").
     */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
