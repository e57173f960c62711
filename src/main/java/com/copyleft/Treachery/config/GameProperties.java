package com.copyleft.Treachery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.server")
public record GameProperties(
        // 방 정원 설정
        int minPlayersPerRoom,   // 설정 가능한 최소 인원 (기본 1)
        int maxPlayersPerRoom,   // 설정 가능한 최대 인원 (기본 20)
        int defaultGameSize,     // 새 방의 기본 프리셋 인원 (기본 5)

        int roomCodeLength,      // 방 코드 길이 (기본 5)
        int countdownSeconds     // 역할 배정 후 게임 시작까지 카운트다운 (기본 5초)
) {}
