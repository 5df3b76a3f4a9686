package uz.legalclinic.bot.util;

import java.util.ArrayList;
import java.util.List;

public final class TextChunker {

    private TextChunker() {}

    /**
     * Packs list entries into as few messages as possible, each at most {@code maxLen} chars.
     * An entry is never split unless it alone is longer than {@code maxLen}, then it is truncated.
     */
    public static List<String> pack(String header, List<String> blocks, int maxLen) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder(header == null ? "" : header);
        for (String block : blocks) {
            String b = Html.truncateHtml(block, maxLen);
            int extra = cur.length() > 0 ? 2 : 0;
            if (cur.length() + extra + b.length() > maxLen) {
                if (cur.length() > 0) out.add(cur.toString());
                cur.setLength(0);
                extra = 0;
            }
            if (extra > 0) cur.append("\n\n");
            cur.append(b);
        }
        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }
}
