package uz.legalclinic.bot.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.config.Config;

import java.util.ArrayList;
import java.util.List;

/**
 * Fans the messages of an outcome out to their chats. Delivery is best effort: the state change
 * behind a message is already committed, so a failed send is logged and the rest still go out.
 */
public final class NotificationRouter {

    private static final Logger log = LoggerFactory.getLogger(NotificationRouter.class);

    private final Notifier notifier;
    private final long reviewerChatId;
    private final long fulfillerChatId;

    public NotificationRouter(Config cfg, Notifier notifier) {
        this.notifier = notifier;
        this.reviewerChatId = cfg.reviewerChatId();
        this.fulfillerChatId = cfg.fulfillerChatId();
    }

    /**
     * Private chats share the id of the actor.
     */
    public long resolve(Destination to) {
        return switch (to.channel()) {
            case PRIVATE -> to.actorId();
            case REVIEWERS -> reviewerChatId;
            case FULFILLERS -> fulfillerChatId;
        };
    }

    /**
     * @return references of the messages sent; edits and failed sends contribute nothing
     */
    public List<MessageRef> deliver(List<OutboundMessage> messages) {
        List<MessageRef> sent = new ArrayList<>();
        for (OutboundMessage m : messages) {
            try {
                switch (m.kind()) {
                    case SEND -> {
                        MessageRef ref = notifier.send(resolve(m.destination()), m.text(), m.actions(), m.options());
                        if (ref != null) sent.add(ref);
                    }
                    case EDIT -> notifier.edit(m.ref(), m.text(), m.actions());
                }
            } catch (RuntimeException e) {
                log.warn("delivery_failed message={} error={}", m, e.getMessage());
            }
        }
        return sent;
    }
}
