package uz.legalclinic.bot.util;

import java.util.ArrayDeque;
import java.util.Deque;

public final class Html {
    private Html() {}

    private static final String ELLIPSIS = "...";

    public static String esc(String s) {
        if (s == null) return "";
        return s
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /**
     * Plain text only. Rendered HTML goes through {@link #truncateHtml}.
     */
    public static String truncate(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        return s.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Cuts rendered HTML to at most {@code max} chars. The cut never lands inside a tag or an entity,
     * and tags left open are closed after the ellipsis.
     */
    public static String truncateHtml(String html, int max) {
        if (html == null) return "";
        if (html.length() <= max) return html;

        Deque<String> open = new ArrayDeque<>();
        String closers = "";
        int cut = 0;
        String cutClosers = "";
        int i = 0;
        while (i < html.length() && i + ELLIPSIS.length() + closers.length() <= max) {
            cut = i;
            cutClosers = closers;

            char ch = html.charAt(i);
            int end = i;
            if (ch == '<' || ch == '&') {
                end = html.indexOf(ch == '<' ? '>' : ';', i);
                if (end < 0) break;
            }
            if (ch == '<') {
                String tag = html.substring(i + 1, end).trim();
                if (tag.startsWith("/")) {
                    open.poll();
                } else if (!tag.endsWith("/")) {
                    open.push(tag.split("\\s+", 2)[0]);
                }
                closers = closers(open);
            }
            i = end + 1;
        }
        return html.substring(0, cut) + ELLIPSIS + cutClosers;
    }

    private static String closers(Deque<String> open) {
        StringBuilder sb = new StringBuilder();
        for (String name : open) sb.append("</").append(name).append('>');
        return sb.toString();
    }
}
