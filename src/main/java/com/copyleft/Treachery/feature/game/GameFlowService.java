package com.copyleft.Treachery.feature.game;

import com.copyleft.Treachery.config.GameProperties;
import com.copyleft.Treachery.domain.CardPool;
import com.copyleft.Treachery.domain.Room;
import com.copyleft.Treachery.domain.ValidationState;
import com.copyleft.Treachery.domain.type.GameState;
import com.copyleft.Treachery.feature.game.event.RoomEvent;
import com.copyleft.Treachery.feature.role.RoleAssigner;
import com.copyleft.Treachery.feature.role.RoleConfigService;
import com.copyleft.Treachery.global.constant.ErrorCode;
import com.copyleft.Treachery.global.exception.GameException;
import com.copyleft.Treachery.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class GameFlowService {

    private static final long COUNTDOWN_TICK_SECONDS = 1L;
    private static final long LOCK_RETRY_MS = 200L;

    private final RoomRepository roomRepository;
    private final GameRoomLockFacade lockFacade;
    private final RoleConfigService roleConfigService;
    private final RoleAssigner roleAssigner;
    private final CardPool cardPool;
    private final TaskScheduler taskScheduler;
    private final GameProperties gameProperties;
    private final ApplicationEventPublisher eventPublisher;


    // 게임 시작

    /**
     * 검증을 통과하면 역할을 배정하고 카운트다운으로 넘어간다.
     * 통과하지 못하면 아무것도 바꾸지 않고 검증 결과만 돌려준다.
     */
    public ValidationState tryStartGame(String roomCode) {
        Room room = findRoom(roomCode);

        LockResult<ValidationState> result = lockFacade.execute(room, () -> {
            ValidationState validation = room.getValidationState(roleConfigService);
            if (!validation.isCanStart()) {
                log.info("게임 시작 불가: room={}, reason={}", roomCode, validation.getValidationMessage());
                return validation;
            }

            room.resetRoles();
            roleAssigner.assignRolesWithConfig(room.getPlayers(), cardPool, room.getRoleConfig());

            room.transitionTo(GameState.COUNTDOWN);
            room.startCountdown(gameProperties.countdownSeconds());
            eventPublisher.publishEvent(RoomEvent.of(roomCode, RoomEvent.Type.GAME_STARTED));
            log.info("역할 배정 완료, 카운트다운 시작: room={}, players={}, countdown={}s",
                    roomCode, room.getActivePlayerCount(), gameProperties.countdownSeconds());

            scheduleCountdownTick(roomCode, Instant.now().plusSeconds(COUNTDOWN_TICK_SECONDS));
            return validation;
        });

        if (result.isLockFailed()) {
            log.warn("게임 시작 실패 (락 획득 실패): room={}", roomCode);
        }
        return result.orElseThrow(ErrorCode.GAME_START_FAILED);
    }


    // 카운트다운

    public void tickCountdown(String roomCode) {
        Room room = roomRepository.findByCode(roomCode).orElse(null);
        if (room == null) {
            return;
        }

        LockResult<Integer> result = lockFacade.execute(room, () -> {
            int remaining = room.tickCountdown();
            if (remaining < 0) {
                return null;
            }

            eventPublisher.publishEvent(RoomEvent.countdown(roomCode, remaining));
            if (remaining > 0) {
                scheduleCountdownTick(roomCode, Instant.now().plusSeconds(COUNTDOWN_TICK_SECONDS));
                return remaining;
            }

            room.transitionTo(GameState.PLAYING);
            eventPublisher.publishEvent(RoomEvent.of(roomCode, RoomEvent.Type.GAME_PLAYING));
            log.info("게임 진행 시작, 리더 공개: room={}, leader={}", roomCode,
                    room.getLeader().map(p -> p.getName()).orElse("-"));
            return remaining;
        });

        if (result.isLockFailed()) {
            scheduleCountdownTick(roomCode, Instant.now().plusMillis(LOCK_RETRY_MS));
        }
    }

    private void scheduleCountdownTick(String roomCode, Instant at) {
        taskScheduler.schedule(() -> tickCountdown(roomCode), at);
    }


    // 게임 종료

    /**
     * @return 진행 중이던 게임을 끝냈으면 true
     */
    public boolean endGame(String roomCode) {
        Room room = findRoom(roomCode);

        LockResult<Boolean> result = lockFacade.execute(room, () -> {
            if (!room.transitionTo(GameState.ENDED)) {
                return null;
            }
            eventPublisher.publishEvent(RoomEvent.of(roomCode, RoomEvent.Type.GAME_ENDED));
            log.info("게임 종료: room={}", roomCode);
            return Boolean.TRUE;
        });

        result.orElseThrow(ErrorCode.ROOM_BUSY);
        if (result.isSkipped()) {
            log.debug("진행 중이 아닌 게임 종료 요청 무시: room={}, state={}", roomCode, room.getState());
        }
        return result.isSuccess();
    }

    private Room findRoom(String roomCode) {
        return roomRepository.findByCode(roomCode)
                .orElseThrow(() -> new GameException(ErrorCode.ROOM_NOT_FOUND));
    }
}
