package uz.legalclinic.bot.telegram;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;
import uz.legalclinic.bot.notify.ActionButton;

import java.util.ArrayList;
import java.util.List;

public final class Keyboards {

    private Keyboards() {}

    private static final int REPLY_COLUMNS = 2;

    public static InlineKeyboardButton btn(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton();
        b.setText(text);
        b.setCallbackData(data);
        return b;
    }

    /**
     * One action per row. An empty list gives an empty markup, which removes the buttons on edit.
     */
    public static InlineKeyboardMarkup inline(List<ActionButton> actions) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (ActionButton a : actions) rows.add(List.of(btn(a.label(), a.data())));
        InlineKeyboardMarkup m = new InlineKeyboardMarkup();
        m.setKeyboard(rows);
        return m;
    }

    public static ReplyKeyboardMarkup reply(List<String> options) {
        List<KeyboardRow> rows = new ArrayList<>();
        KeyboardRow cur = new KeyboardRow();
        for (String o : options) {
            if (cur.size() == REPLY_COLUMNS) {
                rows.add(cur);
                cur = new KeyboardRow();
            }
            cur.add(o);
        }
        if (!cur.isEmpty()) rows.add(cur);
        ReplyKeyboardMarkup m = new ReplyKeyboardMarkup();
        m.setKeyboard(rows);
        m.setResizeKeyboard(true);
        return m;
    }
}
