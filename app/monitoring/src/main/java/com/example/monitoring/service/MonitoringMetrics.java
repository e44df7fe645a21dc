/*
 * どこで: Monitoring サービス層
 * 何を: 所属変更/サイクル操作の結果とスコープ件数をメトリクスへ記録する
 * なぜ: 移管の衝突率や凍結スコープの規模を運用で継続監視できるようにするため
 */
package com.example.monitoring.service;

import com.example.monitoring.api.InvalidCycleTransitionException;
import com.example.monitoring.api.MembershipConflictException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class MonitoringMetrics {

  public static final String RESULT_SUCCESS = "success";
  public static final String RESULT_CONFLICT = "conflict";
  public static final String RESULT_ERROR = "error";

  private static final String METRIC_COMMAND_TOTAL = "monitoring.command.total";
  private static final String METRIC_CYCLE_SCOPE_SIZE = "monitoring.cycle.scope.size";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
  private final DistributionSummary cycleScopeSize;

  public MonitoringMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.cycleScopeSize =
        DistributionSummary.builder(METRIC_CYCLE_SCOPE_SIZE)
            .description("Number of models frozen into a cycle scope at start")
            .baseUnit("models")
            .register(meterRegistry);
  }

  public void recordCommand(String action, String result) {
    final String key = action + ":" + result;
    commandCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("Monitoring command executions")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  /** command を実行し、結果(成功/衝突/その他の失敗)を action ごとに数える。 */
  public <T> T recordOutcome(String action, Supplier<T> command) {
    final T result;
    try {
      result = command.get();
    } catch (MembershipConflictException | InvalidCycleTransitionException ex) {
      recordCommand(action, RESULT_CONFLICT);
      throw ex;
    } catch (RuntimeException ex) {
      recordCommand(action, RESULT_ERROR);
      throw ex;
    }
    recordCommand(action, RESULT_SUCCESS);
    return result;
  }

  public void recordCycleScopeSize(int modelCount) {
    cycleScopeSize.record(Math.max(modelCount, 0));
  }
}
