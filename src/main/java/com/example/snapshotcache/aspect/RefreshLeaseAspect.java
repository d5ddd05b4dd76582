package com.example.snapshotcache.aspect;

import com.example.snapshotcache.annotation.LeasedRefresh;
import com.example.snapshotcache.lease.RefreshLeaseRegistry;
import com.example.snapshotcache.model.RefreshLease;
import com.example.snapshotcache.model.RefreshOutcome;
import com.example.snapshotcache.model.ResourceType;
import com.example.snapshotcache.refresh.RefreshOutcomeRecorder;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

@Aspect
@Component
public class RefreshLeaseAspect {

    private static final Logger log = LoggerFactory.getLogger(RefreshLeaseAspect.class);

    private final RefreshLeaseRegistry leaseRegistry;
    private final RefreshOutcomeRecorder recorder;
    private final Clock clock;

    public RefreshLeaseAspect(RefreshLeaseRegistry leaseRegistry, RefreshOutcomeRecorder recorder, Clock clock) {
        this.leaseRegistry = leaseRegistry;
        this.recorder = recorder;
        this.clock = clock;
    }

    @Around("@annotation(leasedRefresh)")
    public Object guardRefresh(ProceedingJoinPoint joinPoint, LeasedRefresh leasedRefresh) throws Throwable {
        ResourceType type = resourceTypeOf(joinPoint);

        Optional<RefreshLease> lease;
        try {
            lease = leaseRegistry.tryAcquire(type);
        } catch (RuntimeException e) {
            log.warn("Refresh lease for '{}' could not be acquired, skipping this attempt: {}", type.id(), e.getMessage());
            // The coordinator never runs here, so the failed attempt is recorded on its behalf.
            RefreshOutcome outcome = RefreshOutcome.transientFailure(type, "Refresh lease unavailable: " + e.getMessage(), 0);
            recorder.record(outcome, clock.instant());
            return outcome;
        }

        if (lease.isEmpty()) {
            log.debug("Refresh of '{}' already in progress, collapsing trigger", type.id());
            return RefreshOutcome.alreadyInProgress(type);
        }

        try {
            return joinPoint.proceed();
        } finally {
            try {
                leaseRegistry.release(lease.get());
            } catch (RuntimeException e) {
                log.warn("Releasing refresh lease for '{}' failed, it will expire on its own: {}",
                        type.id(), e.getMessage());
            }
        }
    }

    private ResourceType resourceTypeOf(ProceedingJoinPoint joinPoint) {
        for (Object arg : joinPoint.getArgs()) {
            if (arg instanceof ResourceType type) {
                return type;
            }
        }
        throw new IllegalStateException("@LeasedRefresh method needs a ResourceType argument: "
                + joinPoint.getSignature());
    }
}
