package uz.legalclinic.bot.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.model.RequestStatus;

/**
 * Take, reject and return-to-pool. The pre-checks only produce early, friendly conflicts;
 * the guarded writes in {@link RequestService} are what actually keeps one fulfiller per request
 * and one request per fulfiller when two takes race.
 */
public final class AssignmentCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AssignmentCoordinator.class);

    private final RequestService requests;
    private final ActorService actors;

    public AssignmentCoordinator(RequestService requests, ActorService actors) {
        this.requests = requests;
        this.actors = actors;
    }

    public static final class Taken {
        public final Request request;
        public final boolean promoted;

        Taken(Request request, boolean promoted) {
            this.request = request;
            this.promoted = promoted;
        }
    }

    public Taken takeRequest(long requestId, long actorId) {
        Request r = requests.require(requestId);
        if (r.status != RequestStatus.APPROVED) {
            throw new ConflictException(ConflictException.Reason.ALREADY_HANDLED,
                    "Request " + requestId + " is " + r.status);
        }
        Actor a = requireActor(actorId);
        if (a.currentAssignmentId != null) {
            throw new ConflictException(ConflictException.Reason.ASSIGNMENT_CONFLICT,
                    "Actor " + actorId + " already holds request " + a.currentAssignmentId);
        }

        boolean promoted = requests.assign(requestId, actorId);
        log.info("request_taken requestId={} fulfillerId={}", requestId, actorId);
        if (promoted) log.info("actor_promoted tgId={} role=FULFILLER", actorId);
        return new Taken(requests.require(requestId), promoted);
    }

    /**
     * Gives the request back to the pool. Only the actor whose back-reference points at it may do so.
     */
    public Request rejectAssignment(long requestId, long actorId) {
        Actor a = requireActor(actorId);
        if (a.currentAssignmentId == null || a.currentAssignmentId != requestId) {
            throw new ConflictException(ConflictException.Reason.NO_ACTIVE_ASSIGNMENT,
                    "Actor " + actorId + " does not hold request " + requestId);
        }
        requests.release(requestId, actorId);
        log.info("assignment_rejected requestId={} fulfillerId={}", requestId, actorId);
        return requests.require(requestId);
    }

    /**
     * Reviewer declined the answer: the request goes back to APPROVED and the fulfiller is freed.
     *
     * @return id of the fulfiller who lost the request
     */
    public long returnToPool(long requestId, String comment) {
        long former = requests.returnToPool(requestId, comment);
        log.info("answer_declined requestId={} fulfillerId={}", requestId, former);
        return former;
    }

    private Actor requireActor(long actorId) {
        return actors.findById(actorId).orElseThrow(() -> new NotFoundException("Actor " + actorId + " not found"));
    }
}
