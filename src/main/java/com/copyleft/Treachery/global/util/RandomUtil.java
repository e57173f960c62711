package com.copyleft.Treachery.global.util;

import java.security.SecureRandom;
import java.util.UUID;

public class RandomUtil {

    private static final SecureRandom random = new SecureRandom();
    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    /**
     * UUID 생성 (PlayerId용)
     */
    public static String generatePlayerId() {
        return UUID.randomUUID().toString();
    }

    /**
     * 대문자+숫자 코드 생성 (RoomCode용)
     */
    public static String generateRoomCode(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("Room code length must be positive");
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            int index = random.nextInt(ALPHANUMERIC.length());
            sb.append(ALPHANUMERIC.charAt(index));
        }
        return sb.toString();
    }
}
