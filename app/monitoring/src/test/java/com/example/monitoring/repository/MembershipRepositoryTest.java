/*
 * どこで: MembershipRepository の統合テスト
 * 何を: 有効所属の部分一意インデックスと有効期間の CHECK 制約を検証する
 * なぜ: ロック順序が破られても DB が最後の砦として重複所属を拒否することを保証するため
 */
package com.example.monitoring.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.monitoring.AbstractPostgresContainerTest;
import com.example.monitoring.MonitoringFixtures;
import com.example.monitoring.model.MembershipRecord;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;

@SpringBootTest
@ActiveProfiles("test")
class MembershipRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

  @Autowired private MembershipRepository membershipRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private MonitoringFixtures fixtures;

  @BeforeEach
  void setUp() {
    fixtures = new MonitoringFixtures(jdbcTemplate);
    fixtures.truncateAll();
  }

  @Test
  void secondActiveMembershipForSameModelIsRejected() {
    final long planA = fixtures.createPlan("plan-a");
    final long planB = fixtures.createPlan("plan-b");
    final long m1 = fixtures.createModel("model-1");
    membershipRepository.insertActive(m1, planA, T0, "initial", "user-1");

    assertThatThrownBy(
            () -> membershipRepository.insertActive(m1, planB, T0.plusSeconds(1), "dup", "user-1"))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(fixtures.countActiveMemberships(m1)).isEqualTo(1);
  }

  @Test
  void closedMembershipAllowsNewActiveOne() {
    final long planA = fixtures.createPlan("plan-a");
    final long planB = fixtures.createPlan("plan-b");
    final long m1 = fixtures.createModel("model-1");
    final MembershipRecord first =
        membershipRepository.insertActive(m1, planA, T0, "initial", "user-1");

    assertThat(membershipRepository.close(first.membershipId(), T0.plus(1, ChronoUnit.DAYS)))
        .isEqualTo(1);
    membershipRepository.insertActive(m1, planB, T0.plus(1, ChronoUnit.DAYS), "move", "user-1");

    assertThat(membershipRepository.findActiveByModelId(m1))
        .hasValueSatisfying(record -> assertThat(record.planId()).isEqualTo(planB));
    assertThat(membershipRepository.findByModelId(m1)).hasSize(2);
  }

  @Test
  void closingTwiceDoesNotReopenOrMoveEffectiveTo() {
    final long planA = fixtures.createPlan("plan-a");
    final long m1 = fixtures.createModel("model-1");
    final MembershipRecord record =
        membershipRepository.insertActive(m1, planA, T0, "initial", "user-1");
    membershipRepository.close(record.membershipId(), T0.plusSeconds(60));

    assertThat(membershipRepository.close(record.membershipId(), T0.plusSeconds(120))).isZero();
    assertThat(membershipRepository.findByModelId(m1).get(0).effectiveTo())
        .isEqualTo(T0.plusSeconds(60));
  }

  @Test
  void effectiveToMustBeAfterEffectiveFrom() {
    final long planA = fixtures.createPlan("plan-a");
    final long m1 = fixtures.createModel("model-1");
    final MembershipRecord record =
        membershipRepository.insertActive(m1, planA, T0, "initial", "user-1");

    assertThatThrownBy(() -> membershipRepository.close(record.membershipId(), T0))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(membershipRepository.findActiveByModelId(m1)).isPresent();
  }

  @Test
  void lockingReadsRequireSurroundingTransaction() {
    final long planA = fixtures.createPlan("plan-a");

    assertThatThrownBy(() -> membershipRepository.lockActiveByPlanId(planA))
        .isInstanceOf(IllegalTransactionStateException.class);
  }
}
