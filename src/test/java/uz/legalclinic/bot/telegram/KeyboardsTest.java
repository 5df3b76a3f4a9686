package uz.legalclinic.bot.telegram;

import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import uz.legalclinic.bot.notify.ActionButton;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeyboardsTest {

    @Test
    void inlineActionsGetOneRowEach() {
        InlineKeyboardMarkup m = Keyboards.inline(List.of(
                new ActionButton("Approve", "approve:1"),
                new ActionButton("Decline", "decline:1")));

        assertThat(m.getKeyboard()).hasSize(2);
        assertThat(m.getKeyboard().get(1).get(0).getCallbackData()).isEqualTo("decline:1");
    }

    @Test
    void noActionsGiveEmptyMarkup() {
        assertThat(Keyboards.inline(List.of()).getKeyboard()).isEmpty();
    }

    @Test
    void replyOptionsAreLaidOutInTwoColumns() {
        ReplyKeyboardMarkup m = Keyboards.reply(List.of("A", "B", "C"));

        assertThat(m.getKeyboard()).hasSize(2);
        assertThat(m.getKeyboard().get(0)).hasSize(2);
        assertThat(m.getKeyboard().get(1).get(0).getText()).isEqualTo("C");
        assertThat(m.getResizeKeyboard()).isTrue();
    }
}
