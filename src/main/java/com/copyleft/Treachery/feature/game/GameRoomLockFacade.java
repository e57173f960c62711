package com.copyleft.Treachery.feature.game;

import com.copyleft.Treachery.domain.Room;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * 방의 쓰기 락을 잡은 채로 여러 단계의 작업을 실행한다.
 * action 이 null 을 반환하면 실행하지 않은 것으로 보고 skipped 를 돌려준다.
 */
@Slf4j
@Component
public class GameRoomLockFacade {

    private static final long WAIT_TIME_MS = 2000L;  // 락 대기 최대 시간
    private static final int MAX_RETRY = 3;          // 최대 3번 재시도
    private static final long RETRY_DELAY_MS = 300L; // 재시도 사이 0.3초 휴식

    public LockResult<Void> execute(Room room, Runnable action) {
        LockResult<Boolean> result = executeInternal(room, () -> {
            action.run();
            return Boolean.TRUE;
        });
        return result.isLockFailed() ? LockResult.lockFailed() : LockResult.success(null);
    }

    public <T> LockResult<T> execute(Room room, Supplier<T> action) {
        return executeInternal(room, action);
    }

    private <T> LockResult<T> executeInternal(Room room, Supplier<T> action) {
        Lock lock = room.writeLock();

        for (int i = 0; i < MAX_RETRY; i++) {
            boolean available;
            try {
                available = lock.tryLock(WAIT_TIME_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                log.error("락 대기 중 인터럽트: room={}", room.getCode(), e);
                Thread.currentThread().interrupt();
                return LockResult.lockFailed();
            }

            if (available) {
                try {
                    T result = action.get();
                    return (result == null) ? LockResult.skipped() : LockResult.success(result);
                } catch (RuntimeException e) {
                    log.error("비즈니스 로직 오류: room={}", room.getCode(), e);
                    throw e;
                } finally {
                    lock.unlock();
                }
            }

            log.warn("락 획득 실패, 재시도 대기중 ({}/{}): room={}", i + 1, MAX_RETRY, room.getCode());
            try {
                Thread.sleep(RETRY_DELAY_MS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return LockResult.lockFailed();
            }
        }

        log.error("락 획득 최종 실패 (Timeout): room={}", room.getCode());
        return LockResult.lockFailed();
    }
}
