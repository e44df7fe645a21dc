package com.example.monitoring.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class MonitoringCycleStatusTest {

  @Test
  void forwardTransitionsFollowWorkflowOrder() {
    assertThat(MonitoringCycleStatus.PENDING.canTransitionTo(MonitoringCycleStatus.DATA_COLLECTION))
        .isTrue();
    assertThat(
            MonitoringCycleStatus.DATA_COLLECTION.canTransitionTo(
                MonitoringCycleStatus.UNDER_REVIEW))
        .isTrue();
    assertThat(
            MonitoringCycleStatus.UNDER_REVIEW.canTransitionTo(
                MonitoringCycleStatus.PENDING_APPROVAL))
        .isTrue();
    assertThat(
            MonitoringCycleStatus.PENDING_APPROVAL.canTransitionTo(MonitoringCycleStatus.APPROVED))
        .isTrue();
  }

  @Test
  void skippingOrGoingBackIsNotAllowed() {
    assertThat(MonitoringCycleStatus.PENDING.canTransitionTo(MonitoringCycleStatus.UNDER_REVIEW))
        .isFalse();
    assertThat(
            MonitoringCycleStatus.UNDER_REVIEW.canTransitionTo(
                MonitoringCycleStatus.DATA_COLLECTION))
        .isFalse();
  }

  @ParameterizedTest
  @EnumSource(
      value = MonitoringCycleStatus.class,
      names = {"PENDING", "DATA_COLLECTION", "UNDER_REVIEW", "PENDING_APPROVAL"})
  void everyOpenStatusCanBeCancelled(MonitoringCycleStatus status) {
    assertThat(status.canTransitionTo(MonitoringCycleStatus.CANCELLED)).isTrue();
    assertThat(status.isTerminal()).isFalse();
  }

  @ParameterizedTest
  @EnumSource(
      value = MonitoringCycleStatus.class,
      names = {"APPROVED", "CANCELLED"})
  void terminalStatusesAllowNothing(MonitoringCycleStatus status) {
    assertThat(status.isTerminal()).isTrue();
    for (MonitoringCycleStatus next : MonitoringCycleStatus.values()) {
      assertThat(status.canTransitionTo(next)).isFalse();
    }
  }

  @Test
  void onlyStartedOpenCyclesBlockTransfer() {
    assertThat(MonitoringCycleStatus.transferBlockingStatuses())
        .containsExactlyInAnyOrder(
            MonitoringCycleStatus.DATA_COLLECTION,
            MonitoringCycleStatus.UNDER_REVIEW,
            MonitoringCycleStatus.PENDING_APPROVAL);
    assertThat(MonitoringCycleStatus.PENDING.blocksTransfer()).isFalse();
    assertThat(MonitoringCycleStatus.APPROVED.blocksTransfer()).isFalse();
  }
}
