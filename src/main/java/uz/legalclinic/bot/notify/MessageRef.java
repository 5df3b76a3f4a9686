package uz.legalclinic.bot.notify;

import java.util.Objects;

/**
 * Address of a message already delivered, used to edit it later.
 */
public final class MessageRef {

    private final long chatId;
    private final int messageId;

    public MessageRef(long chatId, int messageId) {
        this.chatId = chatId;
        this.messageId = messageId;
    }

    public long chatId() {
        return chatId;
    }

    public int messageId() {
        return messageId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageRef)) return false;
        MessageRef other = (MessageRef) o;
        return chatId == other.chatId && messageId == other.messageId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(chatId, messageId);
    }

    @Override
    public String toString() {
        return chatId + "/" + messageId;
    }
}
