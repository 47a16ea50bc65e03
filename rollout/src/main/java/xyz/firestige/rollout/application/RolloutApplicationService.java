package xyz.firestige.rollout.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.rollout.application.orchestration.RolloutController;
import xyz.firestige.rollout.domain.fleet.FleetStateTracker;
import xyz.firestige.rollout.domain.fleet.InstanceGroup;
import xyz.firestige.rollout.domain.rollout.ReasonCode;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.rollout.RolloutRepository;
import xyz.firestige.rollout.domain.rollout.RolloutRequest;
import xyz.firestige.rollout.domain.rollout.RolloutState;
import xyz.firestige.rollout.domain.rollout.StrategyParams;
import xyz.firestige.rollout.domain.rollout.StrategyType;
import xyz.firestige.rollout.domain.shared.event.DomainEventPublisher;
import xyz.firestige.rollout.domain.shared.exception.InvalidRolloutRequestException;
import xyz.firestige.rollout.domain.shared.exception.RolloutConflictException;
import xyz.firestige.rollout.domain.shared.exception.RolloutNotFoundException;
import xyz.firestige.rollout.domain.shared.exception.StateTransitionException;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.domain.strategy.TrafficPlanner;
import xyz.firestige.rollout.domain.strategy.TrafficPlanners;
import xyz.firestige.rollout.domain.traffic.WeightTable;
import xyz.firestige.rollout.infrastructure.lock.ServiceLeaseManager;
import xyz.firestige.rollout.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.rollout.infrastructure.metrics.RolloutMetrics;
import xyz.firestige.rollout.infrastructure.retry.RetryExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 发布应用服务
 * <p>
 * 职责：
 * 1. 提交：同步校验 → 幂等键去重 → 同服务互斥（仓储 + 服务租约）→ 持久化 → 交给控制器异步驱动
 * 2. 查询：发布记录与服务当前权重
 * 3. 中止：本实例驱动中的直接中断；孤儿发布先接管再中断
 * 4. 运维回滚：已晋升的发布以蓝绿方式重新发布原版本
 */
public class RolloutApplicationService {

    private static final Logger log = LoggerFactory.getLogger(RolloutApplicationService.class);

    private final RolloutRepository repository;
    private final RolloutController controller;
    private final TrafficPlanners planners;
    private final FleetStateTracker tracker;
    private final ServiceLeaseManager leaseManager;
    private final DomainEventPublisher eventPublisher;
    private final RetryExecutor retryExecutor;
    private final MetricsRegistry metrics;
    private final Duration leaseTtl;
    private final ConcurrentMap<String, Object> serviceMonitors = new ConcurrentHashMap<>();

    public RolloutApplicationService(RolloutRepository repository, RolloutController controller,
                                     TrafficPlanners planners, FleetStateTracker tracker,
                                     ServiceLeaseManager leaseManager, DomainEventPublisher eventPublisher,
                                     RetryExecutor retryExecutor, MetricsRegistry metrics, Duration leaseTtl) {
        this.repository = repository;
        this.controller = controller;
        this.planners = planners;
        this.tracker = tracker;
        this.leaseManager = leaseManager;
        this.eventPublisher = eventPublisher;
        this.retryExecutor = retryExecutor;
        this.metrics = metrics;
        this.leaseTtl = leaseTtl;
    }

    // ========== 提交 ==========

    /**
     * 提交发布；立即返回，发布在后台驱动
     *
     * @throws InvalidRolloutRequestException 请求非法
     * @throws RolloutConflictException       服务已有进行中的发布
     */
    public SubmissionResult submit(RolloutRequest request) {
        TrafficPlanner planner = validate(request);
        String serviceName = request.getServiceName();

        synchronized (serviceMonitors.computeIfAbsent(serviceName, k -> new Object())) {
            if (request.getIdempotencyKey() != null) {
                Optional<Rollout> existing = repository.findByIdempotencyKey(request.getIdempotencyKey());
                if (existing.isPresent()) {
                    if (!serviceName.equals(existing.get().getServiceName())) {
                        throw new InvalidRolloutRequestException("幂等键 " + request.getIdempotencyKey()
                                + " 已用于服务 " + existing.get().getServiceName());
                    }
                    log.info("[RolloutApplicationService] 幂等键命中，返回已有发布 {}", existing.get().getId());
                    return SubmissionResult.replayed(existing.get());
                }
            }

            Optional<Rollout> active = repository.findActiveByService(serviceName);
            if (active.isPresent()) {
                metrics.incrementCounter(RolloutMetrics.CONFLICTS, serviceName, request.getStrategy());
                throw new RolloutConflictException(serviceName, active.get().getId().getValue());
            }

            Optional<InstanceGroup> primary = tracker.currentPrimary(serviceName);
            if (planner.requiresSource() && primary.isEmpty()) {
                throw new InvalidRolloutRequestException("策略 " + request.getStrategy() + " 要求服务 " + serviceName
                        + " 已有主版本");
            }

            RolloutId rolloutId = RolloutId.generate();
            String owner = controller.ownerToken(rolloutId);
            if (!leaseManager.tryAcquire(serviceName, owner, leaseTtl)) {
                metrics.incrementCounter(RolloutMetrics.CONFLICTS, serviceName, request.getStrategy());
                throw new RolloutConflictException(serviceName, leaseManager.owner(serviceName).orElse("unknown"));
            }

            Rollout rollout;
            try {
                rollout = Rollout.accept(rolloutId, request,
                        primary.map(InstanceGroup::getId).orElse(null),
                        primary.map(InstanceGroup::getDesiredReplicas).orElse(null));
                retryExecutor.run("saveRollout", () -> repository.save(rollout));
                eventPublisher.publishAll(rollout.pullDomainEvents());
            } catch (RuntimeException e) {
                leaseManager.release(serviceName, owner);
                throw e;
            }

            Rollout accepted = rollout.snapshot();
            MDC.put("rolloutId", rolloutId.getValue());
            try {
                log.info("[RolloutApplicationService] 接受发布: {}", accepted);
            } finally {
                MDC.remove("rolloutId");
            }
            metrics.incrementCounter(RolloutMetrics.SUBMITTED, serviceName, request.getStrategy());
            controller.drive(rollout);
            return SubmissionResult.accepted(accepted);
        }
    }

    private TrafficPlanner validate(RolloutRequest request) {
        if (request == null) {
            throw new InvalidRolloutRequestException("发布请求不能为空");
        }
        if (isBlank(request.getServiceName())) {
            throw new InvalidRolloutRequestException("serviceName 不能为空");
        }
        if (isBlank(request.getArtifactName()) || isBlank(request.getArtifactVersion())) {
            throw new InvalidRolloutRequestException("制品名称和版本不能为空");
        }
        if (request.getStrategy() == null) {
            throw new InvalidRolloutRequestException("strategy 不能为空");
        }
        TrafficPlanner planner = planners.forStrategy(request.getStrategy());
        planner.validate(request.getParams());
        return planner;
    }

    // ========== 查询 ==========

    public Rollout get(RolloutId rolloutId) {
        return repository.findById(rolloutId)
                .orElseThrow(() -> new RolloutNotFoundException(rolloutId.getValue()));
    }

    public List<Rollout> listByService(String serviceName) {
        return repository.findByService(serviceName);
    }

    public WeightTable currentWeights(String serviceName) {
        return tracker.weights(serviceName);
    }

    // ========== 中止 / 回滚 ==========

    /**
     * 中止进行中的发布；接受即返回，回滚在后台执行
     *
     * @throws StateTransitionException 发布已到终态
     * @throws RolloutConflictException 发布由其他实例驱动
     */
    public Rollout abort(RolloutId rolloutId, String reason) {
        Rollout rollout = get(rolloutId);
        if (rollout.isTerminal()) {
            throw new StateTransitionException(rollout.getState().name(), RolloutState.ROLLING_BACK.name(),
                    "发布 " + rolloutId.getValue() + " 已结束（" + rollout.getState() + "），无法中止");
        }
        String diagnostic = reason != null && !reason.isBlank() ? reason : "运维中止";
        if (controller.interrupt(rolloutId, ReasonCode.OPERATOR_ABORTED, diagnostic)) {
            log.info("[RolloutApplicationService] 已请求中止发布 {}", rolloutId);
            return rollout;
        }

        String owner = controller.ownerToken(rolloutId);
        if (leaseManager.tryAcquire(rollout.getServiceName(), owner, leaseTtl)) {
            log.warn("[RolloutApplicationService] 发布 {} 无人驱动，接管后中止", rolloutId);
            controller.drive(rollout);
            controller.interrupt(rolloutId, ReasonCode.OPERATOR_ABORTED, diagnostic);
            return rollout;
        }
        throw new RolloutConflictException(rollout.getServiceName(),
                rolloutId.getValue() + "（由 " + leaseManager.owner(rollout.getServiceName()).orElse("unknown") + " 驱动）");
    }

    /**
     * 运维回滚
     * <p>
     * 进行中的发布等同于中止；已晋升的发布以蓝绿方式重新发布原主版本（不观察，立即切流）。
     */
    public SubmissionResult rollback(RolloutId rolloutId, String reason) {
        Rollout rollout = get(rolloutId);
        if (!rollout.isTerminal()) {
            return SubmissionResult.aborting(abort(rolloutId, reason));
        }
        if (rollout.getState() != RolloutState.PROMOTED) {
            throw new StateTransitionException(rollout.getState().name(), RolloutState.ROLLING_BACK.name(),
                    "发布 " + rolloutId.getValue() + " 已处于 " + rollout.getState() + "，无需回滚");
        }
        if (rollout.getRequest().getStrategy() == StrategyType.SHADOW) {
            throw new InvalidRolloutRequestException("影子发布不接管流量，无需回滚");
        }
        if (rollout.isFirstDeployment()) {
            throw new InvalidRolloutRequestException("发布 " + rolloutId.getValue() + " 是首次部署，没有可回退的版本");
        }
        String primaryId = tracker.currentPrimary(rollout.getServiceName()).map(InstanceGroup::getId).orElse(null);
        if (!rollout.getTargetGroupId().equals(primaryId)) {
            throw new InvalidRolloutRequestException("发布 " + rolloutId.getValue() + " 的实例组已不是当前主版本");
        }
        InstanceGroup source = tracker.require(rollout.getSourceGroupId());

        StrategyParams params = new StrategyParams().soakDuration(Duration.ZERO);
        if (rollout.getSourceReplicas() != null) {
            params.replicas(rollout.getSourceReplicas());
        }
        RolloutRequest request = new RolloutRequest(rollout.getServiceName(), source.getArtifact().getName(),
                source.getArtifact().getVersion(), StrategyType.BLUE_GREEN, params, "rollback:" + rolloutId.getValue());
        log.warn("[RolloutApplicationService] 运维回滚发布 {} -> {}，原因: {}", rolloutId,
                source.getArtifact().coordinates(), reason);
        return submit(request);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
