package in.warroom.transport.stream;

import in.warroom.domain.model.Message;

/**
 * What a subscriber reads from its queue: a published message, a keepalive
 * (nothing arrived within the idle interval), or the end of the stream.
 */
public record StreamEvent(Kind kind, Message message) {

    public enum Kind {
        MESSAGE,
        KEEPALIVE,
        END
    }

    static final StreamEvent KEEPALIVE = new StreamEvent(Kind.KEEPALIVE, null);
    static final StreamEvent END = new StreamEvent(Kind.END, null);

    static StreamEvent of(Message message) {
        return new StreamEvent(Kind.MESSAGE, message);
    }

    public boolean isMessage() {
        return kind == Kind.MESSAGE;
    }

    public boolean isKeepalive() {
        return kind == Kind.KEEPALIVE;
    }

    public boolean isEnd() {
        return kind == Kind.END;
    }
}
