package com.copyleft.Treachery.feature.room;

import com.copyleft.Treachery.config.GameProperties;
import com.copyleft.Treachery.domain.Player;
import com.copyleft.Treachery.domain.RoleConfiguration;
import com.copyleft.Treachery.domain.Room;
import com.copyleft.Treachery.domain.ValidationState;
import com.copyleft.Treachery.domain.type.GameState;
import com.copyleft.Treachery.feature.game.GameRoomLockFacade;
import com.copyleft.Treachery.feature.game.LockResult;
import com.copyleft.Treachery.feature.game.event.RoomEvent;
import com.copyleft.Treachery.feature.role.RoleConfigService;
import com.copyleft.Treachery.global.constant.ErrorCode;
import com.copyleft.Treachery.global.exception.GameException;
import com.copyleft.Treachery.global.util.RandomUtil;
import com.copyleft.Treachery.infra.persistence.RoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private static final int MAX_CODE_ATTEMPTS = 10;
    private static final String DEFAULT_PRESET = "standard";

    private final RoomRepository roomRepository;
    private final RoleConfigService roleConfigService;
    private final GameRoomLockFacade lockFacade;
    private final GameProperties gameProperties;
    private final ApplicationEventPublisher eventPublisher;

    public Room createRoom() {
        RoleConfiguration roleConfig = defaultRoleConfiguration();

        for (int i = 0; i < MAX_CODE_ATTEMPTS; i++) {
            String roomCode = RandomUtil.generateRoomCode(gameProperties.roomCodeLength());
            Room room = new Room(roomCode, gameProperties.maxPlayersPerRoom(), roleConfig);
            if (roomRepository.saveIfAbsent(room)) {
                log.info("방 생성 완료: code={}, preset={}", roomCode, roleConfig.getPresetName());
                return room;
            }
            log.debug("방 코드 중복, 재생성 ({}/{}): code={}", i + 1, MAX_CODE_ATTEMPTS, roomCode);
        }

        log.error("방 코드 생성 실패: {}회 모두 중복", MAX_CODE_ATTEMPTS);
        throw new GameException(ErrorCode.UNKNOWN_ERROR, "could not generate a unique room code");
    }

    public Room getRoom(String roomCode) {
        return roomRepository.findByCode(roomCode)
                .orElseThrow(() -> new GameException(ErrorCode.ROOM_NOT_FOUND));
    }

    /**
     * 이름 중복, 로비 상태 확인과 정원 확인을 방 락 하나로 묶어서 처리한다.
     */
    public Player joinRoom(String roomCode, String name, String sessionId, boolean host) {
        if (name == null || name.isBlank()) {
            throw new GameException(ErrorCode.INVALID_NAME);
        }
        String trimmed = name.trim();
        Room room = getRoom(roomCode);

        LockResult<Player> result = lockFacade.execute(room, () -> {
            // 락을 기다리는 동안 마지막 플레이어가 나가 방이 삭제됐을 수 있다
            if (roomRepository.findByCode(roomCode).orElse(null) != room) {
                throw new GameException(ErrorCode.ROOM_NOT_FOUND);
            }
            boolean duplicate = room.getPlayers().stream()
                    .anyMatch(p -> p.getName().equalsIgnoreCase(trimmed));
            if (duplicate) {
                throw new GameException(ErrorCode.DUPLICATE_NAME);
            }
            if (room.getState() != GameState.LOBBY) {
                throw new GameException(ErrorCode.GAME_ALREADY_STARTED);
            }

            Player player = host ? Player.createHost(trimmed, sessionId) : Player.create(trimmed, sessionId);
            room.addPlayer(player);
            return player;
        });

        Player player = result.orElseThrow(ErrorCode.ROOM_BUSY);
        log.info("방 입장: room={}, player={}, host={}", roomCode, player.getName(), host);
        eventPublisher.publishEvent(RoomEvent.player(roomCode, RoomEvent.Type.PLAYER_JOINED, player.getId()));
        return player;
    }

    /**
     * 없는 플레이어면 아무 일도 하지 않는다. 마지막 플레이어가 나가면 방을 지운다.
     * 퇴장과 삭제는 입장과 같은 방 락 안에서 처리한다.
     */
    public void leaveRoom(String roomCode, String playerId) {
        Room room = roomRepository.findByCode(roomCode).orElse(null);
        if (room == null) {
            return;
        }

        LockResult<Boolean> result = lockFacade.execute(room, () -> {
            if (room.getPlayer(playerId).isEmpty()) {
                return null;
            }
            room.removePlayer(playerId);
            if (!room.isEmpty()) {
                return Boolean.FALSE;
            }
            roomRepository.deleteRoom(roomCode);
            return Boolean.TRUE;
        });

        Boolean deleted = result.orElseThrow(ErrorCode.ROOM_BUSY);
        if (deleted == null) {
            return;
        }

        log.info("방 퇴장: room={}, playerId={}", roomCode, playerId);
        eventPublisher.publishEvent(RoomEvent.player(roomCode, RoomEvent.Type.PLAYER_LEFT, playerId));
        if (deleted) {
            log.info("빈 방 삭제: room={}", roomCode);
        }
    }

    public void updateRoleConfiguration(String roomCode, RoleConfiguration config) {
        roleConfigService.validateConfiguration(config);
        Room room = getRoom(roomCode);

        LockResult<Void> result = lockFacade.execute(room, () -> {
            if (room.getState() != GameState.LOBBY) {
                throw new GameException(ErrorCode.GAME_ALREADY_STARTED);
            }
            room.updateRoleConfig(config.copy());
        });

        result.orElseThrow(ErrorCode.ROOM_BUSY);
        log.info("역할 설정 변경: room={}, preset={}, roles={}",
                roomCode, config.getPresetName(), config.totalConfiguredRoles());
    }

    /**
     * 현재 인원(없으면 기본 인원) 기준으로 프리셋을 적용한다.
     * 해당 인원 분포가 프리셋에 없으면 가장 가까운 분포를 조정해서 채운다.
     */
    public RoleConfiguration applyPreset(String roomCode, String presetName) {
        Room room = getRoom(roomCode);
        int activeCount = room.getActivePlayerCount();
        int gameSize = activeCount > 0 ? activeCount : gameProperties.defaultGameSize();

        RoleConfiguration config = roleConfigService.createFromPreset(presetName, gameSize);
        if (config.totalConfiguredRoles() == 0) {
            roleConfigService.getDistributionForPlayerCount(config, gameSize)
                    .asMap()
                    .forEach(config::setCount);
        }

        updateRoleConfiguration(roomCode, config);
        return config;
    }

    public ValidationState getValidationState(String roomCode) {
        return getRoom(roomCode).getValidationState(roleConfigService);
    }

    private RoleConfiguration defaultRoleConfiguration() {
        try {
            return roleConfigService.createFromPreset(DEFAULT_PRESET, gameProperties.defaultGameSize());
        } catch (GameException e) {
            log.warn("기본 프리셋 적용 실패, 기본 설정 사용: {}", e.getMessage());
            return roleConfigService.createDefaultConfiguration();
        }
    }
}
