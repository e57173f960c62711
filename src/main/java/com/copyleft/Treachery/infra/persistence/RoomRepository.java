package com.copyleft.Treachery.infra.persistence;

import com.copyleft.Treachery.domain.Room;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 방 저장소. 프로세스 메모리에만 보관한다.
 */
@Repository
public class RoomRepository {

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    /**
     * 같은 코드의 방이 이미 있으면 저장하지 않는다.
     *
     * @return 저장 성공 여부
     */
    public boolean saveIfAbsent(Room room) {
        return rooms.putIfAbsent(room.getCode(), room) == null;
    }

    public Optional<Room> findByCode(String roomCode) {
        if (roomCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rooms.get(roomCode));
    }

    public boolean existsByCode(String roomCode) {
        return rooms.containsKey(roomCode);
    }

    public Collection<Room> findAll() {
        return List.copyOf(rooms.values());
    }

    public void deleteRoom(String roomCode) {
        rooms.remove(roomCode);
    }
}
