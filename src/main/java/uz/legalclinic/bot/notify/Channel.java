package uz.legalclinic.bot.notify;

public enum Channel {
    PRIVATE,
    REVIEWERS,
    FULFILLERS
}
