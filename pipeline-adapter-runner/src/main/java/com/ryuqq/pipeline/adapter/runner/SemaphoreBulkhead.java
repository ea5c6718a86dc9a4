package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.core.protection.Bulkhead;
import com.ryuqq.pipeline.core.protection.BulkheadConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Semaphore 기반 Bulkhead.
 *
 * <p>runner 태그 풀 하나 또는 resource group 하나를 나타냅니다. 점유자를 추적하므로
 * 같은 점유자가 두 번 release해도 permit이 늘어나지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class SemaphoreBulkhead implements Bulkhead {

    private static final Logger log = LoggerFactory.getLogger(SemaphoreBulkhead.class);

    private final String name;
    private final BulkheadConfig config;
    private final Semaphore semaphore;
    private final Set<String> holders = ConcurrentHashMap.newKeySet();

    public SemaphoreBulkhead(String name, BulkheadConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.name = name;
        this.config = config;
        this.semaphore = new Semaphore(config.maxConcurrentCalls());
    }

    @Override
    public boolean tryAcquire(String holder) {
        if (holders.contains(holder)) {
            return true;
        }
        if (!semaphore.tryAcquire()) {
            log.debug("Bulkhead '{}' full ({}/{}), {} waits", name, getCurrentConcurrency(),
                config.maxConcurrentCalls(), holder);
            return false;
        }
        holders.add(holder);
        return true;
    }

    @Override
    public void release(String holder) {
        if (holders.remove(holder)) {
            semaphore.release();
        }
    }

    @Override
    public int getCurrentConcurrency() {
        return config.maxConcurrentCalls() - semaphore.availablePermits();
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "SemaphoreBulkhead{" + name + ", " + getCurrentConcurrency() + "/" + config.maxConcurrentCalls() + '}';
    }
}
