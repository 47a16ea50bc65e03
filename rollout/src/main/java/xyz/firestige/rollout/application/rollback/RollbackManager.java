package xyz.firestige.rollout.application.rollback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.orchestration.ReadinessWaiter;
import xyz.firestige.rollout.application.teardown.TeardownScheduler;
import xyz.firestige.rollout.domain.fleet.ClusterScheduler;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.fleet.InstanceGroupLifecycleState;
import xyz.firestige.rollout.domain.health.CheckSuiteFactory;
import xyz.firestige.rollout.domain.health.GateResult;
import xyz.firestige.rollout.domain.health.HealthGate;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.shared.exception.IrrecoverableRolloutException;
import xyz.firestige.rollout.domain.shared.exception.RolloutNotFoundException;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.traffic.TrafficSplitter;
import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.infrastructure.retry.RetryExecutor;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * 回滚管理器：把服务恢复到发布前的主版本
 * <p>
 * 步骤：
 * 1. 停止镜像（影子发布）
 * 2. 滚动发布被缩容的主版本恢复到原副本数并等待就绪
 * 3. 主版本通过轻量健康检查后，100% 流量原子切回主版本
 * 4. 目标实例组标记 ABORTED，宽限期后下线
 * <p>
 * 主版本不存在（首次部署）或不健康时抛出 {@link IrrecoverableRolloutException}：
 * 首次部署的目标实例组被摘流（所有权重归零）；主版本不健康时不改动流量，交给人工处理。
 * <p>
 * 每一步都可以重复执行，崩溃后从 ROLLING_BACK 恢复时整体重做。
 */
public class RollbackManager {

    private static final Logger log = LoggerFactory.getLogger(RollbackManager.class);

    private final RolloutRepository rolloutRepository;
    private final FleetStateTracker tracker;
    private final TrafficSplitter splitter;
    private final ClusterScheduler clusterScheduler;
    private final HealthGate healthGate;
    private final CheckSuiteFactory suiteFactory;
    private final ReadinessWaiter readinessWaiter;
    private final TeardownScheduler teardownScheduler;
    private final RetryExecutor retryExecutor;
    private final Duration restoreTimeout;

    public RollbackManager(RolloutRepository rolloutRepository, FleetStateTracker tracker, TrafficSplitter splitter,
                           ClusterScheduler clusterScheduler, HealthGate healthGate, CheckSuiteFactory suiteFactory,
                           ReadinessWaiter readinessWaiter, TeardownScheduler teardownScheduler,
                           RetryExecutor retryExecutor, Duration restoreTimeout) {
        this.rolloutRepository = rolloutRepository;
        this.tracker = tracker;
        this.splitter = splitter;
        this.clusterScheduler = clusterScheduler;
        this.healthGate = healthGate;
        this.suiteFactory = suiteFactory;
        this.readinessWaiter = readinessWaiter;
        this.teardownScheduler = teardownScheduler;
        this.retryExecutor = retryExecutor;
        this.restoreTimeout = restoreTimeout;
    }

    public RollbackResult rollback(RolloutId rolloutId, String reason) {
        Rollout rollout = rolloutRepository.findById(rolloutId)
                .orElseThrow(() -> new RolloutNotFoundException(rolloutId.getValue()));
        return rollback(rollout, reason);
    }

    public RollbackResult rollback(Rollout rollout, String reason) {
        String serviceName = rollout.getServiceName();
        String targetId = rollout.getTargetGroupId();
        log.warn("[RollbackManager] 开始回滚: service={}, target={}, source={}, 原因: {}",
                serviceName, targetId, rollout.getSourceGroupId(), reason);

        WeightTable current = tracker.weights(serviceName);
        if (targetId != null && targetId.equals(current.getMirrorGroupId())) {
            splitter.stopMirror(serviceName);
            log.info("[RollbackManager] 已停止镜像到 {}", targetId);
        }

        Optional<InstanceGroup> source = tracker.find(rollout.getSourceGroupId())
                .filter(g -> !g.getLifecycleState().isTerminated());
        if (source.isEmpty()) {
            isolateTarget(serviceName, targetId);
            throw new IrrecoverableRolloutException("服务 " + serviceName + " 没有可回退的主版本，目标实例组已摘流");
        }

        InstanceGroup sourceGroup = restoreReplicas(rollout, source.get());
        GateResult gate = healthGate.evaluate(sourceGroup, suiteFactory.lightweightSuite());
        if (!gate.isPassed()) {
            throw new IrrecoverableRolloutException("主版本 " + sourceGroup.getId() + " 不健康，流量保持不变: "
                    + gate.describe());
        }

        tracker.applyWeights(serviceName, Map.of(sourceGroup.getId(), 100));
        abortTarget(targetId);

        String diagnostic = "流量已切回 " + sourceGroup.getId() + (targetId != null ? "，" + targetId + " 已中止" : "");
        log.info("[RollbackManager] 回滚完成: {}", diagnostic);
        return new RollbackResult(sourceGroup.getId(), targetId, diagnostic);
    }

    private InstanceGroup restoreReplicas(Rollout rollout, InstanceGroup source) {
        Integer original = rollout.getSourceReplicas();
        if (original == null || source.getDesiredReplicas() >= original) {
            return source;
        }
        log.info("[RollbackManager] 恢复主版本 {} 副本数 {} -> {}", source.getId(), source.getDesiredReplicas(), original);
        retryExecutor.run("scaleInstanceGroup", () -> clusterScheduler.scaleInstanceGroup(source.getId(), original));
        tracker.updateDesiredReplicas(source.getId(), original);
        try {
            return readinessWaiter.await(source.getId(), original, restoreTimeout).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IrrecoverableRolloutException("主版本 " + source.getId() + " 恢复副本失败: " + cause.getMessage(), cause);
        }
    }

    private void isolateTarget(String serviceName, String targetId) {
        WeightTable table = tracker.weights(serviceName);
        if (table.totalWeight() > 0) {
            Map<String, Integer> zeros = new LinkedHashMap<>();
            table.getWeights().keySet().forEach(id -> zeros.put(id, 0));
            tracker.applyWeights(serviceName, zeros);
        }
        abortTarget(targetId);
    }

    private void abortTarget(String targetId) {
        Optional<InstanceGroup> target = tracker.find(targetId);
        if (target.isEmpty() || target.get().getLifecycleState().isRetired()) {
            return;
        }
        tracker.transition(targetId, InstanceGroupLifecycleState.ABORTED);
        teardownScheduler.scheduleRetired(targetId);
    }
}
