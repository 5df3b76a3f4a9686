package uz.legalclinic.bot.model;

public enum Role {
    REQUESTER,
    FULFILLER,
    REVIEWER;

    public static Role fromDb(String v) {
        if (v == null) return REQUESTER;
        try {
            return Role.valueOf(v.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return REQUESTER;
        }
    }
}
