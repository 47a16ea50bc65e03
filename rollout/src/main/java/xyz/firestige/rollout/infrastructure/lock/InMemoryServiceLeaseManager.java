package xyz.firestige.rollout.infrastructure.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 内存租约（单实例部署、测试使用）
 */
public class InMemoryServiceLeaseManager implements ServiceLeaseManager {

    private final ConcurrentMap<String, Lease> leases = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String serviceName, String owner, Duration ttl) {
        if (serviceName == null || owner == null || ttl == null) {
            return false;
        }
        Lease candidate = new Lease(owner, System.nanoTime() + ttl.toNanos());
        Lease result = leases.compute(serviceName, (k, existing) ->
                existing == null || existing.isExpired() ? candidate : existing);
        return result == candidate;
    }

    @Override
    public boolean renew(String serviceName, String owner, Duration ttl) {
        if (serviceName == null || owner == null || ttl == null) {
            return false;
        }
        Lease renewed = new Lease(owner, System.nanoTime() + ttl.toNanos());
        Lease result = leases.computeIfPresent(serviceName, (k, existing) ->
                !existing.isExpired() && existing.owner.equals(owner) ? renewed : existing);
        return result == renewed;
    }

    @Override
    public void release(String serviceName, String owner) {
        if (serviceName != null && owner != null) {
            leases.computeIfPresent(serviceName, (k, existing) -> existing.owner.equals(owner) ? null : existing);
        }
    }

    @Override
    public boolean exists(String serviceName) {
        return owner(serviceName).isPresent();
    }

    @Override
    public Optional<String> owner(String serviceName) {
        if (serviceName == null) {
            return Optional.empty();
        }
        Lease lease = leases.get(serviceName);
        return lease == null || lease.isExpired() ? Optional.empty() : Optional.of(lease.owner);
    }

    private static final class Lease {
        final String owner;
        final long expiresAtNanos;

        Lease(String owner, long expiresAtNanos) {
            this.owner = owner;
            this.expiresAtNanos = expiresAtNanos;
        }

        boolean isExpired() {
            return System.nanoTime() - expiresAtNanos >= 0;
        }
    }
}
