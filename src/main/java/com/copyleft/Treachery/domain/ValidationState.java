package com.copyleft.Treachery.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 시작 가능 여부 스냅샷. 조회할 때마다 새로 계산되며 version 은 방마다 단조 증가한다.
 */
@Getter
@Builder
@ToString
public class ValidationState {

    private final long version;             // 오래된 UI 상태 감지용
    private final Instant timestamp;
    private final boolean canStart;
    private final String validationMessage; // UI 가 그대로 표시하는 문구

    private final boolean canAutoScale;
    private final String autoScaleDetails;

    private final int requiredRoles;   // 역할이 필요한 인원 (방장 제외)
    private final int configuredRoles; // 현재 설정된 역할 수
}
