package uz.legalclinic.bot.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestStatusTest {

    @Test
    void lifecycleEdges() {
        assertThat(RequestStatus.PENDING.successors()).containsExactlyInAnyOrder(RequestStatus.APPROVED, RequestStatus.DECLINED);
        assertThat(RequestStatus.APPROVED.successors()).containsExactly(RequestStatus.ASSIGNED);
        assertThat(RequestStatus.ASSIGNED.successors()).containsExactlyInAnyOrder(RequestStatus.ANSWERED, RequestStatus.APPROVED);
        assertThat(RequestStatus.ANSWERED.successors()).containsExactlyInAnyOrder(RequestStatus.CLOSED, RequestStatus.APPROVED);
    }

    @Test
    void terminalStatusesGoNowhere() {
        assertThat(RequestStatus.DECLINED.isTerminal()).isTrue();
        assertThat(RequestStatus.CLOSED.isTerminal()).isTrue();
        for (RequestStatus s : RequestStatus.values()) {
            assertThat(RequestStatus.CLOSED.canTransitionTo(s)).isFalse();
        }
    }

    @Test
    void skippingReviewIsNotAnEdge() {
        assertThat(RequestStatus.PENDING.canTransitionTo(RequestStatus.ASSIGNED)).isFalse();
        assertThat(RequestStatus.APPROVED.canTransitionTo(RequestStatus.CLOSED)).isFalse();
        assertThat(RequestStatus.ASSIGNED.canTransitionTo(RequestStatus.CLOSED)).isFalse();
        assertThat(RequestStatus.PENDING.canTransitionTo(null)).isFalse();
    }

    @Test
    void onlyAssignedAndAnsweredHoldAFulfiller() {
        assertThat(RequestStatus.ASSIGNED.holdsFulfiller()).isTrue();
        assertThat(RequestStatus.ANSWERED.holdsFulfiller()).isTrue();
        assertThat(RequestStatus.APPROVED.holdsFulfiller()).isFalse();
        assertThat(RequestStatus.CLOSED.holdsFulfiller()).isFalse();
    }

    @Test
    void parsesStoredValues() {
        assertThat(RequestStatus.fromDb(" answered ")).isEqualTo(RequestStatus.ANSWERED);
        assertThat(RequestStatus.ANSWERED.key()).isEqualTo("answered");
    }
}
