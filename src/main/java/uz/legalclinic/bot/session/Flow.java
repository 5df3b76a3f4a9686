package uz.legalclinic.bot.session;

/**
 * The conversation a session state belongs to.
 */
public enum Flow {
    REQUEST,
    ANSWER,
    REVIEW
}
