package io.terraform.tfe;

import io.terraform.tfe.internal.Sleeper;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Streams the log of a plan or apply while it is still being written.
 *
 * <p>
 * Each read polls the log URL for the next chunk at the current offset. Logs produced by Terraform are framed by an STX
 * byte ({@code 0x02}) at the start and an ETX byte ({@code 0x03}) at the end; once both have been seen an empty poll
 * means the log is complete. Streams that lost their terminator, or never had markers, fall back to asking the
 * {@link LogCompletion} whether the operation has finished.
 * </p>
 *
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
public final class LogReader extends InputStream {

    private static final Logger LOGGER = Logger.getLogger(LogReader.class.getName());

    private static final byte START_OF_TEXT = 0x02;
    private static final byte END_OF_TEXT = 0x03;
    private static final long BACKOFF_MIN_MILLIS = 500;
    private static final long BACKOFF_MAX_MILLIS = 2000;
    private static final int NO_PROGRESS = -2;

    private final TfeClient client;
    private final URI logUrl;
    private final LogCompletion completion;
    private final Sleeper sleeper;

    private long offset;
    private int reads;
    private boolean startOfText;
    private boolean endOfText;
    private boolean finished;

    LogReader(TfeClient client, URI logUrl, LogCompletion completion, Sleeper sleeper) {
        this.client = Objects.requireNonNull(client, "client");
        this.logUrl = Objects.requireNonNull(logUrl, "logUrl");
        this.completion = Objects.requireNonNull(completion, "completion");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = read(single, 0, 1);
        return n == -1 ? -1 : single[0] & 0xFF;
    }

    @Override
    public int read(byte[] buffer, int off, int len) throws IOException {
        Objects.checkFromIndexSize(off, len, buffer.length);
        if (len == 0) {
            return 0;
        }
        if (finished) {
            return -1;
        }

        int written = poll(buffer, off, len);
        if (written != NO_PROGRESS) {
            return written;
        }
        for (reads = 1; ; reads++) {
            try {
                sleeper.sleep(backoff(reads));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                InterruptedIOException interrupted = new InterruptedIOException("log read interrupted");
                interrupted.initCause(ex);
                throw interrupted;
            }
            written = poll(buffer, off, len);
            if (written != NO_PROGRESS) {
                return written;
            }
        }
    }

    /**
     * Fetches one chunk. Returns the number of bytes copied, -1 at the end of the log, or {@link #NO_PROGRESS}.
     */
    private int poll(byte[] buffer, int off, int len) throws IOException {
        URI chunkUrl = withQuery(logUrl, "limit=" + len + "&offset=" + offset);
        int written;
        try (InputStream body = client.newLogRequest(chunkUrl).send().body()) {
            written = body.readNBytes(buffer, off, len);
        } catch (TfeException ex) {
            throw asIOException(ex);
        }

        if (written == 0) {
            if ((startOfText && endOfText)
                || (startOfText && reads % 10 == 0)
                || (!startOfText && reads > 1)) {
                boolean done;
                try {
                    done = completion.isDone();
                } catch (TfeException ex) {
                    throw asIOException(ex);
                }
                if (done) {
                    LOGGER.fine(() -> "[tfe-sdk] log complete at offset " + offset + ": " + logUrl.getPath());
                    finished = true;
                    return -1;
                }
            }
            return NO_PROGRESS;
        }

        offset += written;
        if (!startOfText && buffer[off] == START_OF_TEXT) {
            startOfText = true;
        }
        if (!endOfText && buffer[off + written - 1] == END_OF_TEXT) {
            endOfText = true;
        }
        return written;
    }

    static Duration backoff(int iteration) {
        double millis = Math.pow(2, iteration / 5.0) * BACKOFF_MIN_MILLIS;
        return Duration.ofMillis((long) Math.min(millis, BACKOFF_MAX_MILLIS));
    }

    private static URI withQuery(URI base, String query) {
        String raw = base.toString();
        int fragment = raw.indexOf('#');
        if (fragment >= 0) {
            raw = raw.substring(0, fragment);
        }
        return URI.create(raw + (base.getRawQuery() == null ? "?" : "&") + query);
    }

    private static IOException asIOException(TfeException ex) {
        if (ex.is(TfeError.CANCELLED)) {
            InterruptedIOException interrupted = new InterruptedIOException("log read interrupted");
            interrupted.initCause(ex);
            return interrupted;
        }
        return new IOException(ex.getMessage(), ex);
    }
}
