package com.ryuqq.changecontrol.application.versioned;

import com.ryuqq.changecontrol.core.exception.ContainerBusyException;
import com.ryuqq.changecontrol.core.identification.HierObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 컨테이너별 lock. 같은 컨테이너의 커밋은 직렬화되고 서로 다른 컨테이너는 병렬로 진행됩니다.
 *
 * <p>여러 lock은 항상 uid 오름차순으로 획득하므로, 겹치는 컨테이너에 걸친 커밋 사이에
 * 교착 상태가 생기지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (ContainerLocks.Held held = locks.acquire(List.of(uid))) {
 *     // head 조회, 검증, 커밋
 * }
 * </pre>
 *
 * @author Change Control Team
 * @since 1.0.0
 */
public final class ContainerLocks {

    private static final Logger log = LoggerFactory.getLogger(ContainerLocks.class);

    private final ConcurrentHashMap<HierObjectId, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public ContainerLocks(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * 주어진 모든 컨테이너의 lock 획득.
     *
     * @param uids lock 대상 컨테이너 (중복은 무시)
     * @return close 시 lock을 해제하는 handle
     * @throws ContainerBusyException 제한 시간 안에 lock을 얻지 못했거나 스레드가 interrupt된 경우
     */
    public Held acquire(Collection<HierObjectId> uids) {
        TreeSet<HierObjectId> ordered = new TreeSet<>(Comparator.comparing(HierObjectId::value));
        ordered.addAll(uids);
        List<ReentrantLock> held = new ArrayList<>(ordered.size());
        try {
            for (HierObjectId uid : ordered) {
                ReentrantLock lock = locks.computeIfAbsent(uid, id -> new ReentrantLock());
                if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Container {} still locked after {}ms", uid, timeoutMs);
                    throw new ContainerBusyException("Container " + uid + " is busy (waited " + timeoutMs + "ms)");
                }
                held.add(lock);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(held);
            throw new ContainerBusyException("Interrupted while waiting for container locks", e);
        } catch (RuntimeException e) {
            release(held);
            throw e;
        }
        return new Held(held);
    }

    private static void release(List<ReentrantLock> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            held.get(i).unlock();
        }
    }

    /**
     * 현재 스레드가 보유한 lock. close 시 역순으로 해제.
     */
    public static final class Held implements AutoCloseable {

        private final List<ReentrantLock> locks;

        private Held(List<ReentrantLock> locks) {
            this.locks = locks;
        }

        @Override
        public void close() {
            release(locks);
        }
    }
}
