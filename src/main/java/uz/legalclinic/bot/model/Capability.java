package uz.legalclinic.bot.model;

public enum Capability {
    CAN_REQUEST,
    CAN_FULFILL,
    CAN_REVIEW
}
