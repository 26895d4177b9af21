package org.learningjava.embbench.domain.service.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces lowercase pseudo-words (3 to 8 letters each), one word per requested token.
 * Output is fully determined by the seed the instance was built with.
 */
public class SyntheticTextGenerator {

    private static final int MIN_WORD = 3;
    private static final int MAX_WORD = 8;

    private final Random random;

    public SyntheticTextGenerator(long seed) {
        this.random = new Random(seed);
    }

    public String text(int approxTokens) {
        int words = Math.max(1, approxTokens);
        StringBuilder sb = new StringBuilder(words * (MAX_WORD + 1));
        for (int w = 0; w < words; w++) {
            if (w > 0) sb.append(' ');
            int len = MIN_WORD + random.nextInt(MAX_WORD - MIN_WORD + 1);
            for (int c = 0; c < len; c++) {
                sb.append((char) ('a' + random.nextInt(26)));
            }
        }
        return sb.toString();
    }

    /** {@code count} request payloads of {@code batchSize} texts each. */
    public List<List<String>> batches(int count, int batchSize, int approxTokens) {
        List<List<String>> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            List<String> batch = new ArrayList<>(batchSize);
            for (int j = 0; j < batchSize; j++) batch.add(text(approxTokens));
            out.add(List.copyOf(batch));
        }
        return out;
    }
}
