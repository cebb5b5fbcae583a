package io.github.hotbrkm.outreach.dispatcher.send.worker;

import io.github.hotbrkm.outreach.dispatcher.send.transport.DeliveryReceipt;
import io.github.hotbrkm.outreach.dispatcher.send.transport.DeliveryTransport;
import io.github.hotbrkm.outreach.dispatcher.send.transport.OutreachMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a transport call with an upper bound on its duration.
 * <p>
 * A call that exceeds the timeout is cancelled and reported as a failed receipt whose cause is a
 * {@link TimeoutException}, so it is classified as a network failure. Exceptions thrown by the transport
 * are converted into failed receipts as well.
 */
@Slf4j
class TransportInvoker implements AutoCloseable {

    private final DeliveryTransport transport;
    private final long timeoutMillis;
    private final ExecutorService executor;

    TransportInvoker(DeliveryTransport transport, long timeoutMillis) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.timeoutMillis = timeoutMillis;
        this.executor = timeoutMillis > 0 ? Executors.newCachedThreadPool(new DaemonThreadFactory()) : null;
    }

    DeliveryReceipt invoke(OutreachMessage message) throws InterruptedException {
        if (executor == null) {
            return invokeDirect(message);
        }

        Future<DeliveryReceipt> future = executor.submit(() -> invokeDirect(message));
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("event=send_timeout, to={}, timeoutMs={}", message.to(), timeoutMillis);
            return DeliveryReceipt.failure("Send timeout after " + timeoutMillis + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return DeliveryReceipt.failure(cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private DeliveryReceipt invokeDirect(OutreachMessage message) {
        try {
            DeliveryReceipt receipt = transport.send(message);
            if (receipt == null) {
                return DeliveryReceipt.failure("Transport returned no receipt");
            }
            return receipt;
        } catch (RuntimeException e) {
            return DeliveryReceipt.failure(e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "outreach-transport-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
