package com.copyleft.Treachery.global.exception;

import com.copyleft.Treachery.global.constant.ErrorCode;
import lombok.Getter;

@Getter
public class GameException extends RuntimeException {

    private final ErrorCode errorCode;

    public GameException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    // 상세 메시지가 필요한 설정 오류용
    public GameException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }
}
