package com.z254.magi.live;

import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * A response body read up to a byte cap.
 *
 * @param bytes the bytes kept
 * @param truncated whether the body exceeded the cap
 */
public record BoundedBody(byte[] bytes, boolean truncated) {

    public static final BoundedBody EMPTY = new BoundedBody(new byte[0], false);

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Read a body stream, keeping at most {@code maxBytes}. Reading stops and the upstream is
     * cancelled once one byte past the cap has arrived. Every buffer is released.
     */
    public static Mono<BoundedBody> read(Flux<DataBuffer> body, int maxBytes) {
        return DataBufferUtils.takeUntilByteCount(body, (long) maxBytes + 1)
                .reduceWith(() -> new Accumulator(maxBytes), Accumulator::append)
                .map(Accumulator::toBody);
    }

    private static final class Accumulator {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final int maxBytes;
        private boolean truncated;

        private Accumulator(int maxBytes) {
            this.maxBytes = maxBytes;
        }

        private Accumulator append(DataBuffer buffer) {
            try {
                int readable = buffer.readableByteCount();
                int allowed = Math.min(readable, maxBytes - out.size());
                if (allowed > 0) {
                    byte[] chunk = new byte[allowed];
                    buffer.read(chunk);
                    out.write(chunk, 0, allowed);
                }
                if (allowed < readable) {
                    truncated = true;
                }
            } finally {
                DataBufferUtils.release(buffer);
            }
            return this;
        }

        private BoundedBody toBody() {
            return new BoundedBody(out.toByteArray(), truncated);
        }
    }
}
