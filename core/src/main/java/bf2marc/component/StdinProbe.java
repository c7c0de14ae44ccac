package bf2marc.component;

import bf2marc.exception.InputException;
import bf2marc.exception.NoInputException;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits a bounded time for the first byte of a stream that may never deliver anything, typically stdin
 * when the tool is started without a pipe.
 */
public class StdinProbe {

    /**
     * Returns a stream equivalent to the given one once its first byte has arrived.
     * @throws NoInputException if nothing arrived within waitMillis, or the stream was empty.
     */
    public static InputStream awaitInput(InputStream in, long waitMillis) throws InputException {
        // The reader thread may stay blocked after a timeout, it must not keep the JVM alive.
        ExecutorService reader = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("stdin-probe-%d")
                .setDaemon(true)
                .build());
        try {
            Future<Integer> firstByte = reader.submit(() -> in.read());
            int b;
            try {
                b = firstByte.get(waitMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                firstByte.cancel(true);
                throw new NoInputException("No input arrived on standard input within " + waitMillis + " ms");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NoInputException("Interrupted while waiting for standard input");
            } catch (ExecutionException e) {
                throw new InputException("Could not read standard input: " + e.getCause().getMessage(), e.getCause());
            }

            if (b == -1) {
                throw new NoInputException("Standard input was empty");
            }
            return new SequenceInputStream(new ByteArrayInputStream(new byte[]{(byte) b}), in);
        } finally {
            reader.shutdownNow();
        }
    }
}
