package uz.legalclinic.bot.notify;

import java.util.Objects;

/**
 * Inline action attached to a message. {@code data} is the callback payload, at most 64 bytes.
 */
public final class ActionButton {

    private final String label;
    private final String data;

    public ActionButton(String label, String data) {
        this.label = Objects.requireNonNull(label, "label");
        this.data = Objects.requireNonNull(data, "data");
    }

    public String label() {
        return label;
    }

    public String data() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActionButton)) return false;
        ActionButton b = (ActionButton) o;
        return label.equals(b.label) && data.equals(b.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, data);
    }

    @Override
    public String toString() {
        return "[" + label + " -> " + data + "]";
    }
}
