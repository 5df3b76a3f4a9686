package uz.legalclinic.bot.notify;

import java.util.Objects;

/**
 * Logical recipient of a message. Broadcast channels are mapped to chat ids by {@link NotificationRouter}.
 */
public final class Destination {

    private static final Destination REVIEWERS = new Destination(Channel.REVIEWERS, 0L);
    private static final Destination FULFILLERS = new Destination(Channel.FULFILLERS, 0L);

    private final Channel channel;
    private final long actorId;

    private Destination(Channel channel, long actorId) {
        this.channel = channel;
        this.actorId = actorId;
    }

    public static Destination actor(long actorId) {
        return new Destination(Channel.PRIVATE, actorId);
    }

    public static Destination reviewers() {
        return REVIEWERS;
    }

    public static Destination fulfillers() {
        return FULFILLERS;
    }

    public Channel channel() {
        return channel;
    }

    /**
     * Only meaningful for {@link Channel#PRIVATE}.
     */
    public long actorId() {
        return actorId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Destination)) return false;
        Destination d = (Destination) o;
        return channel == d.channel && actorId == d.actorId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, actorId);
    }

    @Override
    public String toString() {
        return channel == Channel.PRIVATE ? "actor:" + actorId : channel.name().toLowerCase();
    }
}
