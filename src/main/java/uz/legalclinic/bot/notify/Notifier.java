package uz.legalclinic.bot.notify;

import java.util.List;

/**
 * Outbound side of the transport.
 */
public interface Notifier {

    /**
     * @param options reply-keyboard labels; empty keeps the recipient's current keyboard
     * @throws DeliveryException when the message could not be delivered
     */
    MessageRef send(long chatId, String text, List<ActionButton> actions, List<String> options);

    /**
     * Replaces text and inline actions of a delivered message. An empty action list removes the buttons.
     *
     * @throws DeliveryException when the message could not be edited
     */
    void edit(MessageRef ref, String text, List<ActionButton> actions);
}
