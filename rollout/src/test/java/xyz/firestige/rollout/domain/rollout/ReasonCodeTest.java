package xyz.firestige.rollout.domain.rollout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.rollout.domain.shared.exception.ArtifactInvalidException;
import xyz.firestige.rollout.domain.shared.exception.ArtifactNotFoundException;
import xyz.firestige.rollout.domain.shared.exception.IrrecoverableRolloutException;
import xyz.firestige.rollout.domain.shared.exception.ProvisioningTimeoutException;
import xyz.firestige.rollout.domain.shared.exception.TransientInfrastructureException;
import xyz.firestige.rollout.domain.shared.exception.UnexpectedTerminationException;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
@DisplayName("异常归类为原因码")
class ReasonCodeTest {

    @Test
    void mapsKnownFailures() {
        assertEquals(ReasonCode.ARTIFACT_NOT_FOUND, ReasonCode.fromFailure(new ArtifactNotFoundException("x")));
        assertEquals(ReasonCode.ARTIFACT_INVALID, ReasonCode.fromFailure(new ArtifactInvalidException("x")));
        assertEquals(ReasonCode.PROVISIONING_TIMEOUT, ReasonCode.fromFailure(new ProvisioningTimeoutException("x")));
        assertEquals(ReasonCode.UNEXPECTED_TERMINATION, ReasonCode.fromFailure(new UnexpectedTerminationException("x")));
        assertEquals(ReasonCode.INFRASTRUCTURE_FAILURE, ReasonCode.fromFailure(new TransientInfrastructureException("x")));
        assertEquals(ReasonCode.ROLLBACK_IMPOSSIBLE, ReasonCode.fromFailure(new IrrecoverableRolloutException("x")));
    }

    @Test
    void unknownFailureIsInternalError() {
        assertEquals(ReasonCode.INTERNAL_ERROR, ReasonCode.fromFailure(new IllegalStateException("bug")));
        assertEquals(ReasonCode.INTERNAL_ERROR, ReasonCode.fromFailure(new NullPointerException()));
    }
}
