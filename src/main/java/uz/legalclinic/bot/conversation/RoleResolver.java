package uz.legalclinic.bot.conversation;

import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Capability;

import java.util.EnumSet;

/**
 * The only place where roles turn into permissions.
 */
public final class RoleResolver {

    public EnumSet<Capability> capabilities(Actor actor) {
        if (actor == null || actor.banned) return EnumSet.noneOf(Capability.class);
        return switch (actor.role) {
            // a requester may take from the fulfiller chat and is promoted on the first take
            case REQUESTER -> EnumSet.of(Capability.CAN_REQUEST, Capability.CAN_FULFILL);
            case FULFILLER -> EnumSet.of(Capability.CAN_FULFILL);
            case REVIEWER -> EnumSet.of(Capability.CAN_REVIEW);
        };
    }
}
