package kr.crownrpg.connector.core.database;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 로그 상관관계용 커넥션 ID 생성기.
 */
public final class ConnectionIds {

    public static final int DEFAULT_LENGTH = 16;

    private static final char[] CHARSET =
            "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz".toCharArray();

    private ConnectionIds() {}

    public static String next() {
        return random(DEFAULT_LENGTH);
    }

    public static String random(int length) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        char[] out = new char[length];
        for (int i = 0; i < length; i++) {
            out[i] = CHARSET[rnd.nextInt(CHARSET.length)];
        }
        return new String(out);
    }
}
