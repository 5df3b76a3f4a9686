package uz.legalclinic.bot.conversation;

import uz.legalclinic.bot.i18n.Translator;
import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Capability;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.notify.ActionButton;
import uz.legalclinic.bot.util.Html;
import uz.legalclinic.bot.util.TimeUtil;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Text building shared by the flows. Private messages use the actor's language, broadcasts the default one.
 * Everything user-supplied is escaped here, templates may carry HTML.
 */
final class Replies {

    // raw lengths, clipped before escaping so a card with question and answer stays under one message
    static final int CARD_FIELD_LEN = 1700;
    static final int COMMENT_LEN = 300;

    private final Translator tr;
    private final Map<String, ActionName> signals = new HashMap<>();

    Replies(Translator tr) {
        this.tr = tr;
        for (String locale : tr.supportedLocales()) {
            for (ActionName a : ActionName.values()) {
                if (!a.targeted()) signals.putIfAbsent(tr.resolve(a.labelKey(), locale), a);
            }
        }
    }

    String locale(Actor a) {
        return a != null && tr.isSupported(a.language) ? a.language : tr.defaultLocale();
    }

    String t(Actor a, String key) {
        return tr.resolve(key, locale(a));
    }

    String t(Actor a, String key, Map<String, ?> params) {
        return tr.resolve(key, locale(a), params);
    }

    String broadcast(String key, Map<String, ?> params) {
        return tr.resolve(key, tr.defaultLocale(), params);
    }

    String error(Actor a, String reason) {
        return t(a, "errors." + reason);
    }

    /**
     * The action whose reply-keyboard label in any language equals {@code text}.
     */
    Optional<ActionName> signal(String text) {
        if (text == null) return Optional.empty();
        return Optional.ofNullable(signals.get(text.trim()));
    }

    List<String> options(Actor a, ActionName... names) {
        List<String> out = new ArrayList<>();
        for (ActionName n : names) out.add(t(a, n.labelKey()));
        return out;
    }

    List<String> menu(Actor a, Set<Capability> caps) {
        if (caps.contains(Capability.CAN_REVIEW)) {
            return options(a, ActionName.REVIEW_STATS, ActionName.CATEGORIES, ActionName.ADD_CATEGORY, ActionName.HELP);
        }
        if (caps.contains(Capability.CAN_REQUEST)) {
            return options(a, ActionName.ASK, ActionName.MY_REQUESTS, ActionName.HELP);
        }
        if (caps.contains(Capability.CAN_FULFILL)) {
            return options(a, ActionName.CURRENT_ASSIGNMENT, ActionName.MY_ANSWERS, ActionName.FULFILLER_STATS, ActionName.HELP);
        }
        return List.of();
    }

    ActionButton button(ActionName action, long targetId) {
        return new ActionButton(tr.resolve(action.labelKey(), tr.defaultLocale()), action.callbackData(targetId));
    }

    static String name(Actor a) {
        return a == null ? "?" : Html.esc(a.displayName());
    }

    /**
     * Parameters every request card template understands.
     */
    static Map<String, Object> card(Request r, String categoryLabel) {
        Map<String, Object> p = new HashMap<>();
        p.put("id", r.id);
        p.put("category", Html.esc(categoryLabel));
        p.put("text", Html.esc(Html.truncate(r.text, CARD_FIELD_LEN)));
        p.put("date", TimeUtil.displayDate(r.createdAt));
        p.put("answer", Html.esc(Html.truncate(r.answerText, CARD_FIELD_LEN)));
        p.put("comment", Html.esc(Html.truncate(r.reviewerComment, COMMENT_LEN)));
        return p;
    }
}
