package uz.legalclinic.bot.notify;

import java.util.List;
import java.util.Objects;

/**
 * One message an outcome asks to deliver: either a new message to a {@link Destination}
 * or an edit of a message already sent.
 */
public final class OutboundMessage {

    public enum Kind { SEND, EDIT }

    private final Kind kind;
    private final Destination destination;
    private final MessageRef ref;
    private final String text;
    private final List<ActionButton> actions;
    private final List<String> options;

    private OutboundMessage(Kind kind, Destination destination, MessageRef ref, String text,
                            List<ActionButton> actions, List<String> options) {
        this.kind = kind;
        this.destination = destination;
        this.ref = ref;
        this.text = Objects.requireNonNull(text, "text");
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.options = options == null ? List.of() : List.copyOf(options);
    }

    public static OutboundMessage send(Destination to, String text, List<ActionButton> actions, List<String> options) {
        return new OutboundMessage(Kind.SEND, Objects.requireNonNull(to, "destination"), null, text, actions, options);
    }

    public static OutboundMessage send(Destination to, String text) {
        return send(to, text, null, null);
    }

    public static OutboundMessage edit(MessageRef ref, String text, List<ActionButton> actions) {
        return new OutboundMessage(Kind.EDIT, null, Objects.requireNonNull(ref, "ref"), text, actions, null);
    }

    public Kind kind() { return kind; }
    public Destination destination() { return destination; }
    public MessageRef ref() { return ref; }
    public String text() { return text; }
    public List<ActionButton> actions() { return actions; }

    /**
     * Reply-keyboard labels offered to the recipient; empty means keep whatever they have.
     */
    public List<String> options() { return options; }

    @Override
    public String toString() {
        return kind == Kind.SEND
                ? "send(" + destination + ", " + actions.size() + " actions)"
                : "edit(" + ref + ", " + actions.size() + " actions)";
    }
}
