package uz.legalclinic.bot.telegram;

import uz.legalclinic.bot.conversation.ActionName;
import uz.legalclinic.bot.conversation.ConversationEngine;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Callback-data should be <= 64 bytes.
 * Format is {@code <action-code>:<id>}, {@code lang:<locale>} for the language picker, and
 * {@code onboard:<locale>} or {@code offer:accept|decline} during onboarding.
 */
public final class CallbackData {
    private CallbackData() {}

    public static final int MAX_BYTES = 64;

    public static final String LANGUAGE_PREFIX = ConversationEngine.LANGUAGE_PREFIX;
    public static final String ONBOARDING_PREFIX = ConversationEngine.ONBOARDING_PREFIX;

    public static final class Parsed {
        public final ActionName action;
        public final Long target;

        Parsed(ActionName action, Long target) {
            this.action = action;
            this.target = target;
        }
    }

    public static Optional<Parsed> parse(String data) {
        if (data == null || data.isBlank()) return Optional.empty();
        if (data.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) return Optional.empty();

        int sep = data.indexOf(':');
        String code = sep < 0 ? data : data.substring(0, sep);
        Optional<ActionName> action = ActionName.fromCode(code);
        if (action.isEmpty()) return Optional.empty();

        Long target = null;
        if (sep >= 0) {
            try {
                target = Long.parseLong(data.substring(sep + 1));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.of(new Parsed(action.get(), target));
    }

    public static boolean isLanguage(String data) {
        return data != null && data.startsWith(LANGUAGE_PREFIX);
    }

    public static boolean isOnboarding(String data) {
        return data != null && data.startsWith(ONBOARDING_PREFIX);
    }

    public static boolean isOffer(String data) {
        return ConversationEngine.OFFER_ACCEPT.equals(data) || ConversationEngine.OFFER_DECLINE.equals(data);
    }

    /**
     * Locale of a {@code lang:} or {@code onboard:} callback.
     */
    public static String locale(String data) {
        return data.substring(data.indexOf(':') + 1);
    }
}
