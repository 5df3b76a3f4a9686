package uz.legalclinic.bot.model;

public final class Category {
    public long id;
    public String name;
    public String hashtag;
    public String createdAt;
    public String updatedAt;

    public String label() {
        return hashtag == null || hashtag.isBlank() ? name : name + " " + hashtag;
    }
}
