package com.copyleft.Treachery.feature.game;

import com.copyleft.Treachery.global.constant.ErrorCode;
import com.copyleft.Treachery.global.exception.GameException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 방 락 안에서 실행한 작업의 결과.
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class LockResult<T> {
    private final T data;
    private final Status status;

    public enum Status {
        SUCCESS,            // 실행 완료
        LOCK_FAILED,        // 재시도 후에도 방 락을 얻지 못함
        BUSINESS_SKIPPED    // 락은 얻었지만 방 상태가 맞지 않아 건너뜀
    }

    public static <T> LockResult<T> success(T data) {
        return new LockResult<>(data, Status.SUCCESS);
    }

    public static <T> LockResult<T> lockFailed() {
        return new LockResult<>(null, Status.LOCK_FAILED);
    }

    public static <T> LockResult<T> skipped() {
        return new LockResult<>(null, Status.BUSINESS_SKIPPED);
    }

    public boolean isLockFailed() { return status == Status.LOCK_FAILED; }
    public boolean isSkipped() { return status == Status.BUSINESS_SKIPPED; }
    public boolean isSuccess() { return status == Status.SUCCESS; }

    /**
     * 락을 얻지 못했으면 주어진 코드로 실패시키고, 아니면 결과를 돌려준다 (건너뛴 경우 null).
     */
    public T orElseThrow(ErrorCode lockFailure) {
        if (isLockFailed()) {
            throw new GameException(lockFailure);
        }
        return data;
    }
}
