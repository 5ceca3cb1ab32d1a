package com.rivalapex.adexport.manager.id;

import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

/**
 * 作业 ID 生成：前缀-毫秒时间戳-9位 base36 随机串，例如 job-1709251200000-k3j9x0a2b。
 */
@Component
public class JobIdGenerator {

    static final int RANDOM_LENGTH = 9;

    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    public String nextJobId() {
        return next("job");
    }

    public String nextSyncId() {
        return next("sync");
    }

    private String next(String prefix) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(prefix.length() + 24);
        sb.append(prefix).append('-').append(System.currentTimeMillis()).append('-');
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }
}
