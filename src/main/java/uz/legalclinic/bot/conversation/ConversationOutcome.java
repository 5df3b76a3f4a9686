package uz.legalclinic.bot.conversation;

import uz.legalclinic.bot.notify.ActionButton;
import uz.legalclinic.bot.notify.Destination;
import uz.legalclinic.bot.notify.MessageRef;
import uz.legalclinic.bot.notify.OutboundMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * What one inbound event produced: a result tag, the messages to deliver, how the actor's session
 * changed, and an optional short notice for the callback answer.
 */
public final class ConversationOutcome {

    public enum Result { OK, REJECTED, CONFLICT, UNHANDLED }

    public enum SessionChange { UNCHANGED, SET, CLEARED }

    private static final ConversationOutcome UNHANDLED =
            new ConversationOutcome(Result.UNHANDLED, null, List.of(), SessionChange.UNCHANGED, null);

    private final Result result;
    private final String reason;
    private final List<OutboundMessage> messages;
    private final SessionChange sessionChange;
    private final String notice;

    private ConversationOutcome(Result result, String reason, List<OutboundMessage> messages,
                                SessionChange sessionChange, String notice) {
        this.result = result;
        this.reason = reason;
        this.messages = List.copyOf(messages);
        this.sessionChange = sessionChange;
        this.notice = notice;
    }

    public static Builder ok() {
        return new Builder(Result.OK, null);
    }

    public static Builder rejected(String reason) {
        return new Builder(Result.REJECTED, reason);
    }

    public static Builder conflict(String reason) {
        return new Builder(Result.CONFLICT, reason);
    }

    /**
     * Input that no state expected; the transport may fall through to its own handling.
     */
    public static ConversationOutcome unhandled() {
        return UNHANDLED;
    }

    public Result result() { return result; }
    public String reason() { return reason; }
    public List<OutboundMessage> messages() { return messages; }
    public SessionChange sessionChange() { return sessionChange; }

    /**
     * Short text for a callback answer, or null.
     */
    public String notice() { return notice; }

    public boolean isOk() {
        return result == Result.OK;
    }

    /**
     * {@code ok}, {@code unhandled}, {@code rejected:<reason>} or {@code conflict:<reason>}.
     */
    public String tag() {
        return switch (result) {
            case OK -> "ok";
            case UNHANDLED -> "unhandled";
            case REJECTED -> "rejected:" + reason;
            case CONFLICT -> "conflict:" + reason;
        };
    }

    @Override
    public String toString() {
        return tag() + " " + messages + " session=" + sessionChange;
    }

    public static final class Builder {
        private final Result result;
        private final String reason;
        private final List<OutboundMessage> messages = new ArrayList<>();
        private SessionChange sessionChange = SessionChange.UNCHANGED;
        private String notice;

        private Builder(Result result, String reason) {
            this.result = result;
            this.reason = reason;
        }

        public Builder send(Destination to, String text) {
            messages.add(OutboundMessage.send(to, text));
            return this;
        }

        public Builder send(Destination to, String text, List<ActionButton> actions, List<String> options) {
            messages.add(OutboundMessage.send(to, text, actions, options));
            return this;
        }

        public Builder edit(MessageRef ref, String text, List<ActionButton> actions) {
            if (ref != null) messages.add(OutboundMessage.edit(ref, text, actions));
            return this;
        }

        public Builder session(SessionChange change) {
            this.sessionChange = change;
            return this;
        }

        public Builder notice(String text) {
            this.notice = text;
            return this;
        }

        public ConversationOutcome build() {
            return new ConversationOutcome(result, reason, messages, sessionChange, notice);
        }
    }
}
