package uz.legalclinic.bot.model;

public final class FulfillerStats {
    public int total;
    public int inProgress;
    public int awaitingReview;
    public int completed;

    /**
     * Completed share in percent, or -1 when nothing was assigned yet.
     */
    public double completionRate() {
        if (total == 0) return -1;
        return completed * 100.0 / total;
    }
}
