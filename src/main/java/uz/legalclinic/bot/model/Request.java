package uz.legalclinic.bot.model;

public final class Request {
    public long id;
    public long requesterId;
    public long categoryId;
    public String text;

    public RequestStatus status = RequestStatus.PENDING;

    // Non-null exactly while status is ASSIGNED or ANSWERED.
    public Long fulfillerId;
    public String answerText;
    public String reviewerComment;

    // Author of the last submitted answer; survives close for history and stats.
    public Long answeredBy;

    public String createdAt;
    public String updatedAt;
}
