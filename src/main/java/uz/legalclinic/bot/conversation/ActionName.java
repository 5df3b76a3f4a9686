package uz.legalclinic.bot.conversation;

import java.util.Optional;

/**
 * Every signal the engine understands. Signals without a target can also arrive as typed reply-keyboard
 * labels; targeted ones only as inline callbacks ({@code <code>:<id>}).
 */
public enum ActionName {
    ASK("ask", "buttons.ask", false),
    BACK("back", "buttons.back", false),
    CONFIRM("confirm", "buttons.confirm", false),
    EDIT("edit", "buttons.edit", false),
    TAKE("take", "buttons.take", true),
    REJECT_ASSIGNMENT("reject", "buttons.reject_assignment", false),
    CONFIRM_ANSWER("confirm_answer", "buttons.confirm_answer", false),
    EDIT_ANSWER("edit_answer", "buttons.edit_answer", false),
    APPROVE_REQUEST("approve", "buttons.approve", true),
    DECLINE_REQUEST("decline", "buttons.decline", true),
    APPROVE_ANSWER("approve_answer", "buttons.approve_answer", true),
    DECLINE_ANSWER("decline_answer", "buttons.decline_answer", true),
    MY_REQUESTS("my_requests", "buttons.my_requests", false),
    MY_ANSWERS("my_answers", "buttons.my_answers", false),
    CURRENT_ASSIGNMENT("current", "buttons.current_assignment", false),
    FULFILLER_STATS("fstats", "buttons.statistics", false),
    HELP("help", "buttons.help", false),
    REVIEW_STATS("rstats", "buttons.review_stats", false),
    CATEGORIES("categories", "buttons.categories", false),
    ADD_CATEGORY("add_cat", "buttons.add_category", false),
    RENAME_CATEGORY("ren_cat", "buttons.rename_category", true),
    DELETE_CATEGORY("del_cat", "buttons.delete_category", true);

    private final String code;
    private final String labelKey;
    private final boolean targeted;

    ActionName(String code, String labelKey, boolean targeted) {
        this.code = code;
        this.labelKey = labelKey;
        this.targeted = targeted;
    }

    public String code() {
        return code;
    }

    public String labelKey() {
        return labelKey;
    }

    /**
     * True if the action is meaningless without a request or category id.
     */
    public boolean targeted() {
        return targeted;
    }

    public String callbackData(long targetId) {
        return code + ":" + targetId;
    }

    public static Optional<ActionName> fromCode(String code) {
        for (ActionName a : values()) {
            if (a.code.equals(code)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
