package com.copyleft.Treachery.feature.room;

import com.copyleft.Treachery.config.GameProperties;
import com.copyleft.Treachery.domain.Player;
import com.copyleft.Treachery.domain.RoleConfiguration;
import com.copyleft.Treachery.domain.Room;
import com.copyleft.Treachery.domain.type.GameState;
import com.copyleft.Treachery.domain.type.RoleType;
import com.copyleft.Treachery.feature.game.GameRoomLockFacade;
import com.copyleft.Treachery.feature.game.LockResult;
import com.copyleft.Treachery.feature.game.event.RoomEvent;
import com.copyleft.Treachery.feature.role.RoleConfigService;
import com.copyleft.Treachery.feature.role.RoleDistribution;
import com.copyleft.Treachery.global.constant.ErrorCode;
import com.copyleft.Treachery.global.exception.GameException;
import com.copyleft.Treachery.infra.persistence.RoomRepository;
import com.copyleft.Treachery.support.GameFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomServiceTest {

    @InjectMocks
    private RoomService roomService;

    @Mock private RoomRepository roomRepository;
    @Mock private RoleConfigService roleConfigService;
    @Mock private GameRoomLockFacade lockFacade;
    @Mock private GameProperties gameProperties;
    @Mock private ApplicationEventPublisher eventPublisher;

    private static final String CODE = "ABCDE";

    @BeforeEach
    void setUp() {
        // LockFacade 가 락 없이 로직을 바로 실행하도록 설정
        lenient().doAnswer(invocation -> {
            Supplier<?> action = invocation.getArgument(1);
            Object result = action.get();
            return result == null ? LockResult.skipped() : LockResult.success(result);
        }).when(lockFacade).execute(any(Room.class), any(Supplier.class));
        lenient().doAnswer(invocation -> {
            Runnable action = invocation.getArgument(1);
            action.run();
            return LockResult.success(null);
        }).when(lockFacade).execute(any(Room.class), any(Runnable.class));

        lenient().when(gameProperties.roomCodeLength()).thenReturn(5);
        lenient().when(gameProperties.maxPlayersPerRoom()).thenReturn(4);
        lenient().when(gameProperties.defaultGameSize()).thenReturn(5);
    }

    private Room givenRoom() {
        Room room = new Room(CODE, 4, GameFixtures.customConfig(1, 2, 0, 1));
        lenient().when(roomRepository.findByCode(CODE)).thenReturn(Optional.of(room));
        return room;
    }

    @Test
    @DisplayName("방 생성 시 코드가 겹치면 다시 만들고 standard 프리셋을 적용한다")
    void createRoom_RetriesOnDuplicateCode() {
        // given
        RoleConfiguration preset = GameFixtures.customConfig(1, 2, 1, 1);
        preset.setPresetName("standard");
        when(roleConfigService.createFromPreset("standard", 5)).thenReturn(preset);
        when(roomRepository.saveIfAbsent(any(Room.class))).thenReturn(false, true);

        // when
        Room room = roomService.createRoom();

        // then
        assertEquals(5, room.getCode().length());
        assertTrue(room.getCode().matches("[A-Z0-9]{5}"));
        assertEquals(4, room.getMaxPlayers());
        assertEquals(GameState.LOBBY, room.getState());
        assertSame(preset, room.getRoleConfig());
        verify(roomRepository, times(2)).saveIfAbsent(any(Room.class));
    }

    @Test
    @DisplayName("기본 프리셋을 쓸 수 없으면 기본 설정으로 방을 만든다")
    void createRoom_FallsBackToDefaultConfiguration() {
        // given
        RoleConfiguration fallback = GameFixtures.customConfig(1, 0, 0, 0);
        when(roleConfigService.createFromPreset("standard", 5))
                .thenThrow(new GameException(ErrorCode.PRESET_NOT_FOUND, "preset 'standard' not found"));
        when(roleConfigService.createDefaultConfiguration()).thenReturn(fallback);
        when(roomRepository.saveIfAbsent(any(Room.class))).thenReturn(true);

        // when
        Room room = roomService.createRoom();

        // then
        assertSame(fallback, room.getRoleConfig());
    }

    @Test
    @DisplayName("없는 방 코드면 ROOM_NOT_FOUND")
    void getRoom_NotFound() {
        when(roomRepository.findByCode("ZZZZZ")).thenReturn(Optional.empty());

        GameException e = assertThrows(GameException.class, () -> roomService.getRoom("ZZZZZ"));

        assertEquals(ErrorCode.ROOM_NOT_FOUND, e.getErrorCode());
    }

    @Test
    @DisplayName("입장 성공 시 플레이어가 추가되고 PLAYER_JOINED 이벤트가 발행된다")
    void joinRoom_Success() {
        // given
        Room room = givenRoom();

        // when
        Player player = roomService.joinRoom(CODE, "  Alice ", "session-1", false);

        // then
        assertEquals("Alice", player.getName());
        assertFalse(player.isHost());
        assertSame(player, room.getPlayer(player.getId()).orElseThrow());

        ArgumentCaptor<RoomEvent> captor = ArgumentCaptor.forClass(RoomEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals(RoomEvent.Type.PLAYER_JOINED, captor.getValue().getType());
        assertEquals(player.getId(), captor.getValue().getPlayerId());
    }

    @Test
    @DisplayName("빈 이름이면 INVALID_NAME")
    void joinRoom_BlankName() {
        GameException e = assertThrows(GameException.class, () -> roomService.joinRoom(CODE, "   ", "s", false));

        assertEquals(ErrorCode.INVALID_NAME, e.getErrorCode());
        verifyNoInteractions(roomRepository);
    }

    @Test
    @DisplayName("대소문자만 다른 같은 이름이 있으면 DUPLICATE_NAME")
    void joinRoom_DuplicateName() {
        // given
        Room room = givenRoom();
        room.addPlayer(Player.create("alice", "session-0"));

        // when
        GameException e = assertThrows(GameException.class, () -> roomService.joinRoom(CODE, "ALICE", "session-1", false));

        // then
        assertEquals(ErrorCode.DUPLICATE_NAME, e.getErrorCode());
        assertEquals(1, room.getPlayers().size());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("게임이 이미 시작된 방에는 들어갈 수 없다")
    void joinRoom_GameAlreadyStarted() {
        // given
        Room room = givenRoom();
        room.transitionTo(GameState.COUNTDOWN);

        // when
        GameException e = assertThrows(GameException.class, () -> roomService.joinRoom(CODE, "bob", "s", false));

        // then
        assertEquals(ErrorCode.GAME_ALREADY_STARTED, e.getErrorCode());
    }

    @Test
    @DisplayName("정원이 찬 방은 ROOM_FULL, 방장은 그래도 들어갈 수 있다")
    void joinRoom_RoomFull() {
        // given
        Room room = givenRoom();
        for (int i = 0; i < 4; i++) {
            room.addPlayer(Player.create("p" + i, "s" + i));
        }

        // when
        GameException e = assertThrows(GameException.class, () -> roomService.joinRoom(CODE, "late", "s9", false));
        Player host = roomService.joinRoom(CODE, "host", "s10", true);

        // then
        assertEquals(ErrorCode.ROOM_FULL, e.getErrorCode());
        assertTrue(host.isHost());
        assertEquals(4, room.getActivePlayerCount());
    }

    @Test
    @DisplayName("방 락을 잡지 못하면 ROOM_BUSY")
    void joinRoom_LockFailed() {
        // given
        givenRoom();
        doReturn(LockResult.lockFailed()).when(lockFacade).execute(any(Room.class), any(Supplier.class));

        // when
        GameException e = assertThrows(GameException.class, () -> roomService.joinRoom(CODE, "bob", "s", false));

        // then
        assertEquals(ErrorCode.ROOM_BUSY, e.getErrorCode());
    }

    @Test
    @DisplayName("퇴장 시 PLAYER_LEFT 이벤트가 발행되고 마지막 플레이어면 방이 삭제된다")
    void leaveRoom_DeletesEmptyRoom() {
        // given
        Room room = givenRoom();
        Player player = Player.create("alice", "s1");
        room.addPlayer(player);

        // when
        roomService.leaveRoom(CODE, player.getId());

        // then
        assertTrue(room.isEmpty());
        verify(eventPublisher).publishEvent(any(RoomEvent.class));
        verify(roomRepository).deleteRoom(CODE);
    }

    @Test
    @DisplayName("없는 플레이어 퇴장은 아무 일도 일어나지 않는다")
    void leaveRoom_UnknownPlayer() {
        // given
        Room room = givenRoom();
        room.addPlayer(Player.create("alice", "s1"));

        // when
        roomService.leaveRoom(CODE, "unknown");
        roomService.leaveRoom("NOPE1", "unknown");

        // then
        assertEquals(1, room.getPlayers().size());
        verifyNoInteractions(eventPublisher);
        verify(roomRepository, never()).deleteRoom(anyString());
    }

    @Test
    @DisplayName("락을 기다리는 사이 방이 삭제됐으면 입장은 ROOM_NOT_FOUND")
    void joinRoom_RoomDeletedWhileWaitingForLock() {
        // given
        Room room = new Room(CODE, 4, GameFixtures.customConfig(1, 0, 0, 0));
        when(roomRepository.findByCode(CODE)).thenReturn(Optional.of(room), Optional.empty());

        // when
        GameException e = assertThrows(GameException.class, () -> roomService.joinRoom(CODE, "bob", "s", false));

        // then
        assertEquals(ErrorCode.ROOM_NOT_FOUND, e.getErrorCode());
        assertTrue(room.isEmpty());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("마지막 플레이어 퇴장과 새 입장이 겹쳐도 삭제된 방에 들어간 플레이어가 생기지 않는다")
    void leaveAndJoin_Concurrent() throws Exception {
        // given (실제 저장소와 락 사용)
        RoomRepository repository = new RoomRepository();
        RoomService service = new RoomService(repository, GameFixtures.roleConfigService(),
                new GameRoomLockFacade(), GameFixtures.gameProperties(), event -> { });
        ExecutorService executor = Executors.newFixedThreadPool(2);
        int orphaned = 0;

        try {
            for (int i = 0; i < 300; i++) {
                Room room = service.createRoom();
                String code = room.getCode();
                Player first = service.joinRoom(code, "first", "s1", false);
                CountDownLatch start = new CountDownLatch(1);

                // when
                Future<?> leave = executor.submit(() -> {
                    start.await();
                    service.leaveRoom(code, first.getId());
                    return null;
                });
                Future<Player> join = executor.submit(() -> {
                    start.await();
                    try {
                        return service.joinRoom(code, "second", "s2", false);
                    } catch (GameException e) {
                        assertEquals(ErrorCode.ROOM_NOT_FOUND, e.getErrorCode());
                        return null;
                    }
                });
                start.countDown();
                leave.get(5, TimeUnit.SECONDS);
                Player second = join.get(5, TimeUnit.SECONDS);

                // then
                if (second != null) {
                    Room registered = repository.findByCode(code).orElse(null);
                    if (registered != room || registered.getPlayer(second.getId()).isEmpty()) {
                        orphaned++;
                    }
                    service.leaveRoom(code, second.getId());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, orphaned);
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    @DisplayName("로비가 아니면 역할 설정을 바꿀 수 없다")
    void updateRoleConfiguration_NotLobby() {
        // given
        Room room = givenRoom();
        RoleConfiguration before = room.getRoleConfig();
        room.transitionTo(GameState.COUNTDOWN);

        // when
        GameException e = assertThrows(GameException.class,
                () -> roomService.updateRoleConfiguration(CODE, GameFixtures.customConfig(1, 0, 0, 0)));

        // then
        assertEquals(ErrorCode.GAME_ALREADY_STARTED, e.getErrorCode());
        assertSame(before, room.getRoleConfig());
    }

    @Test
    @DisplayName("검증에 실패한 설정은 적용되지 않는다")
    void updateRoleConfiguration_InvalidConfig() {
        // given
        Room room = givenRoom();
        RoleConfiguration before = room.getRoleConfig();
        RoleConfiguration invalid = GameFixtures.customConfig(2, 0, 0, 0);
        doThrow(new GameException(ErrorCode.INVALID_ROLE_CONFIG, "cannot have more than 1 leader, got 2"))
                .when(roleConfigService).validateConfiguration(invalid);

        // when
        assertThrows(GameException.class, () -> roomService.updateRoleConfiguration(CODE, invalid));

        // then
        assertSame(before, room.getRoleConfig());
    }

    @Test
    @DisplayName("역할 설정은 복사본으로 저장된다")
    void updateRoleConfiguration_StoresCopy() {
        // given
        Room room = givenRoom();
        RoleConfiguration config = GameFixtures.customConfig(1, 1, 0, 0);

        // when
        roomService.updateRoleConfiguration(CODE, config);
        config.setCount(RoleType.GUARDIAN, 5);

        // then
        assertEquals(1, room.getRoleConfig().getCount(RoleType.GUARDIAN));
        assertEquals(2, room.getRoleConfig().totalConfiguredRoles());
    }

    @Test
    @DisplayName("프리셋 적용 시 현재 인원에 맞는 분포가 없으면 자동 조정된 분포로 채운다")
    void applyPreset_UsesActivePlayerCount() {
        // given
        Room room = givenRoom();
        for (int i = 0; i < 3; i++) {
            room.addPlayer(Player.create("p" + i, "s" + i));
        }
        RoleConfiguration empty = RoleConfiguration.builder().presetName("scale").minPlayers(3).maxPlayers(3).build();
        when(roleConfigService.createFromPreset("scale", 3)).thenReturn(empty);
        when(roleConfigService.getDistributionForPlayerCount(eq(empty), anyInt()))
                .thenReturn(RoleDistribution.builder().set(RoleType.LEADER, 1).set(RoleType.GUARDIAN, 1).set(RoleType.TRAITOR, 1).build());

        // when
        RoleConfiguration applied = roomService.applyPreset(CODE, "scale");

        // then
        assertEquals(3, applied.totalConfiguredRoles());
        assertEquals("scale", room.getRoleConfig().getPresetName());
        assertEquals(1, room.getRoleConfig().getCount(RoleType.LEADER));
        verify(roleConfigService).validateConfiguration(applied);
    }
}
