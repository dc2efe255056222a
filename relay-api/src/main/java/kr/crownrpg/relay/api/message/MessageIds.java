package kr.crownrpg.relay.api.message;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Correlation ids of the form {@code <prefix>_<epochMillis>_<9 base36 chars>}.
 * <p>
 * Good enough for logging and request/reply correlation; not suitable as a security token.
 */
public final class MessageIds {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 9;

    private MessageIds() {
    }

    public static String generate() {
        return generate("msg");
    }

    public static String generate(String prefix) {
        StringBuilder builder = new StringBuilder(prefix.length() + 24);
        builder.append(prefix).append('_').append(System.currentTimeMillis()).append('_');
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }
}
