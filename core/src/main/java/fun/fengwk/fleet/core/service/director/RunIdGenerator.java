package fun.fengwk.fleet.core.service.director;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates run ids of the form {@code EXE-} plus 12 upper-case hex digits.
 *
 * <p>The digits come from a SHA-256 of the current instant and a process-local sequence, so runs
 * created in the same instant still get distinct ids.
 *
 * @author fengwk
 */
@Component
public class RunIdGenerator {

    static final String PREFIX = "EXE-";
    private static final int HEX_LENGTH = 12;

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong(0);

    public RunIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        String seed = clock.instant().toString() + "#" + sequence.incrementAndGet();
        byte[] digest = sha256(seed.getBytes(StandardCharsets.UTF_8));
        return PREFIX + HexFormat.of().withUpperCase().formatHex(digest).substring(0, HEX_LENGTH);
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

}
