package uz.legalclinic.bot.model;

public final class Actor {
    public long tgId;

    public Role role = Role.REQUESTER;

    public String username;
    public String firstName;
    public String lastName;
    public String language;

    public boolean banned;

    // Set once the clinic's terms were accepted during onboarding.
    public boolean offerAccepted;

    // Back-reference to the request this actor holds; maintained together with the request row.
    public Long currentAssignmentId;

    public String createdAt;
    public String updatedAt;

    public String displayName() {
        if (username != null && !username.isBlank()) return "@" + username;
        String name = ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
        return name.isEmpty() ? "ID:" + tgId : name;
    }
}
