package uz.legalclinic.bot.i18n;

import java.util.Map;
import java.util.Set;

public interface Translator {

    /**
     * Text for a dotted key such as {@code errors.general}, with {@code {{name}}} placeholders
     * filled from {@code params}. Falls back to the default locale, then to the key itself.
     */
    String resolve(String key, String locale, Map<String, ?> params);

    default String resolve(String key, String locale) {
        return resolve(key, locale, Map.of());
    }

    Set<String> supportedLocales();

    String defaultLocale();

    default boolean isSupported(String locale) {
        return locale != null && supportedLocales().contains(locale);
    }
}
