package com.copyleft.Treachery.domain;

import com.copyleft.Treachery.domain.type.GameState;
import com.copyleft.Treachery.domain.type.RoleType;
import com.copyleft.Treachery.feature.role.AutoScaleResult;
import com.copyleft.Treachery.feature.role.RoleConfigService;
import com.copyleft.Treachery.global.constant.ErrorCode;
import com.copyleft.Treachery.global.exception.GameException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * 게임 방. 참가자, 진행 상태, 역할 설정을 하나의 읽기/쓰기 락으로 보호한다.
 * 상태 전이는 외부(게임 흐름)가 호출하며, 방은 전이 가능 여부만 판단한다.
 */
public class Room {

    private final String code;
    private final int maxPlayers;
    private final Instant createdAt;
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private GameState state = GameState.LOBBY;
    private RoleConfiguration roleConfig;

    private Instant startedAt;
    private int countdownRemaining;
    private boolean leaderRevealed;

    private long validationVersion;
    private Instant lastValidatedAt;

    public Room(String code, int maxPlayers, RoleConfiguration roleConfig) {
        this.code = code;
        this.maxPlayers = maxPlayers;
        this.roleConfig = roleConfig;
        this.createdAt = Instant.now();
    }

    public String getCode() {
        return code;
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    // 정원 확인과 추가를 하나의 임계 구역에서 처리
    public void addPlayer(Player player) {
        lock.writeLock().lock();
        try {
            if (!player.isHost() && countActivePlayers() >= maxPlayers) {
                throw new GameException(ErrorCode.ROOM_FULL);
            }
            players.put(player.getId(), player);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void removePlayer(String playerId) {
        lock.writeLock().lock();
        try {
            players.remove(playerId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Player> getPlayer(String playerId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(players.get(playerId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 방장을 포함한 전체 참가자. 목록은 복사본이지만 원소는 방이 가진 객체 그대로다.
     */
    public List<Player> getPlayers() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(players.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Player> getActivePlayers() {
        lock.readLock().lock();
        try {
            return players.values().stream()
                    .filter(p -> !p.isHost())
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getActivePlayerCount() {
        lock.readLock().lock();
        try {
            return countActivePlayers();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return players.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 대략적인 시작 가능 여부. 역할 수 검증은 {@link #getValidationState(RoleConfigService)} 에서 한다.
     */
    public boolean canStart() {
        lock.readLock().lock();
        try {
            return state == GameState.LOBBY && countActivePlayers() >= 1;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Player> getLeader() {
        lock.readLock().lock();
        try {
            return players.values().stream()
                    .filter(p -> p.getRole() != null && p.getRole().getRoleType() == RoleType.LEADER)
                    .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public GameState getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean canTransitionTo(GameState next) {
        return getState().canTransitionTo(next);
    }

    /**
     * 허용된 전이만 적용한다. 불가능한 전이는 예외 없이 false.
     */
    public boolean transitionTo(GameState next) {
        lock.writeLock().lock();
        try {
            if (!state.canTransitionTo(next)) {
                return false;
            }
            state = next;
            if (next == GameState.COUNTDOWN) {
                startedAt = Instant.now();
            } else if (next == GameState.PLAYING) {
                countdownRemaining = 0;
                leaderRevealed = true;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void startCountdown(int seconds) {
        lock.writeLock().lock();
        try {
            countdownRemaining = Math.max(seconds, 0);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return 감소 후 남은 초. 카운트다운 중이 아니면 -1
     */
    public int tickCountdown() {
        lock.writeLock().lock();
        try {
            if (state != GameState.COUNTDOWN) {
                return -1;
            }
            if (countdownRemaining > 0) {
                countdownRemaining--;
            }
            return countdownRemaining;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getCountdownRemaining() {
        lock.readLock().lock();
        try {
            return countdownRemaining;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getStartedAt() {
        lock.readLock().lock();
        try {
            return startedAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isLeaderRevealed() {
        lock.readLock().lock();
        try {
            return leaderRevealed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public RoleConfiguration getRoleConfig() {
        lock.readLock().lock();
        try {
            return roleConfig;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void updateRoleConfig(RoleConfiguration roleConfig) {
        lock.writeLock().lock();
        try {
            this.roleConfig = roleConfig;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void resetRoles() {
        lock.writeLock().lock();
        try {
            players.values().forEach(Player::clearRole);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 역할 배정처럼 여러 단계를 원자적으로 처리해야 하는 호출자가 쥐는 쓰기 락.
     */
    public Lock writeLock() {
        return lock.writeLock();
    }

    /**
     * 시작 가능 여부를 판단하는 유일한 기준. 호출할 때마다 version 이 증가한다.
     */
    public ValidationState getValidationState(RoleConfigService roleConfigService) {
        long version;
        Instant timestamp;
        GameState currentState;
        int activeCount;
        RoleConfiguration config;

        lock.writeLock().lock();
        try {
            validationVersion++;
            Instant now = Instant.now();
            lastValidatedAt = (lastValidatedAt != null && now.isBefore(lastValidatedAt)) ? lastValidatedAt : now;

            version = validationVersion;
            timestamp = lastValidatedAt;
            currentState = state;
            activeCount = countActivePlayers();
            config = roleConfig == null ? null : roleConfig.copy();
        } finally {
            lock.writeLock().unlock();
        }

        ValidationState.ValidationStateBuilder builder = ValidationState.builder()
                .version(version)
                .timestamp(timestamp)
                .requiredRoles(activeCount)
                .validationMessage("");

        if (currentState != GameState.LOBBY) {
            return builder.canStart(false).validationMessage("Game is not in lobby state").build();
        }
        if (activeCount < 1) {
            return builder.canStart(false).validationMessage("Need at least 1 player to start").build();
        }
        if (config == null) {
            return builder.canStart(true).build();
        }

        int totalRoles = config.totalConfiguredRoles();
        builder.configuredRoles(totalRoles);

        if (!config.hasLeader() && !config.isAllowLeaderlessGame()) {
            return builder.canStart(false)
                    .validationMessage("Leader role is required (or enable leaderless games)")
                    .build();
        }

        int leaderCount = config.getCount(RoleType.LEADER);
        if (leaderCount > 1) {
            return builder.canStart(false)
                    .validationMessage(String.format("Only 1 leader role is allowed (%d configured)", leaderCount))
                    .build();
        }

        if (totalRoles == activeCount) {
            return builder.canStart(true).build();
        }

        if (totalRoles > activeCount) {
            return builder.canStart(false)
                    .validationMessage(String.format("Too many roles configured (%d) for %d players", totalRoles, activeCount))
                    .build();
        }

        String notEnough = String.format("Not enough roles configured (%d) for %d players", totalRoles, activeCount);
        if (config.isCustom() || roleConfigService == null) {
            return builder.canStart(false)
                    .validationMessage(notEnough)
                    .autoScaleDetails(config.isCustom() ? RoleConfigService.CUSTOM_NO_AUTO_SCALE : null)
                    .build();
        }

        AutoScaleResult autoScale = roleConfigService.canAutoScale(config, activeCount);
        builder.canAutoScale(autoScale.canScale()).autoScaleDetails(autoScale.details());
        if (autoScale.canScale()) {
            return builder.canStart(true)
                    .validationMessage(String.format("Will auto-scale roles from %d to %d players", totalRoles, activeCount))
                    .build();
        }
        return builder.canStart(false)
                .validationMessage(notEnough + ". " + autoScale.details())
                .build();
    }

    private int countActivePlayers() {
        int count = 0;
        for (Player p : players.values()) {
            if (!p.isHost()) {
                count++;
            }
        }
        return count;
    }
}
