package xyz.firestige.rollout.facade;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.rollout.application.RolloutApplicationService;
import xyz.firestige.rollout.application.SubmissionResult;
import xyz.firestige.rollout.domain.rollout.Rollout;
import xyz.firestige.rollout.domain.shared.exception.InvalidRolloutRequestException;
import xyz.firestige.rollout.domain.shared.vo.RolloutId;
import xyz.firestige.rollout.facade.converter.RolloutConverter;
import xyz.firestige.rollout.facade.dto.RolloutRequestDto;
import xyz.firestige.rollout.facade.dto.RolloutView;
import xyz.firestige.rollout.facade.dto.SubmissionView;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 发布 Facade
 * <p>
 * 职责（纯胶水层）：
 * 1. 参数格式校验（快速失败）
 * 2. DTO 转换：外部 DTO → 领域请求，领域对象 → 查询视图
 * 3. 委派给 {@link RolloutApplicationService}
 * <p>
 * 错误通过 {@link xyz.firestige.rollout.domain.shared.exception.RolloutException} 子类抛出，由调用方映射。
 */
public class RolloutFacade {

    private static final Logger logger = LoggerFactory.getLogger(RolloutFacade.class);

    private final RolloutApplicationService applicationService;
    private final RolloutConverter converter;
    private final Validator validator;

    public RolloutFacade(RolloutApplicationService applicationService, RolloutConverter converter,
                         Validator validator) {
        this.applicationService = applicationService;
        this.converter = converter;
        this.validator = validator;
    }

    public SubmissionView submit(RolloutRequestDto request) {
        if (request == null) {
            throw new InvalidRolloutRequestException("发布请求不能为空");
        }
        Set<ConstraintViolation<RolloutRequestDto>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(v -> String.format("[%s] %s", v.getPropertyPath(), v.getMessage()))
                    .sorted()
                    .collect(Collectors.joining("; "));
            logger.warn("[Facade] 发布请求格式校验失败: {}", detail);
            throw new InvalidRolloutRequestException("发布请求格式校验失败: " + detail);
        }
        SubmissionResult result = applicationService.submit(converter.toDomain(request));
        logger.info("[Facade] 提交发布 {} -> {}", request.getServiceName(), result);
        return converter.toView(result);
    }

    public RolloutView get(String rolloutId) {
        Rollout rollout = applicationService.get(RolloutId.of(rolloutId));
        return converter.toView(rollout, applicationService.currentWeights(rollout.getServiceName()));
    }

    public List<RolloutView> listByService(String serviceName) {
        return applicationService.listByService(serviceName).stream()
                .map(r -> converter.toView(r, applicationService.currentWeights(serviceName)))
                .collect(Collectors.toList());
    }

    public RolloutView abort(String rolloutId, String reason) {
        Rollout rollout = applicationService.abort(RolloutId.of(rolloutId), reason);
        logger.info("[Facade] 中止发布 {}", rolloutId);
        return converter.toView(rollout, applicationService.currentWeights(rollout.getServiceName()));
    }

    public SubmissionView rollback(String rolloutId, String reason) {
        SubmissionResult result = applicationService.rollback(RolloutId.of(rolloutId), reason);
        logger.info("[Facade] 回滚发布 {} -> {}", rolloutId, result);
        return converter.toView(result);
    }
}
