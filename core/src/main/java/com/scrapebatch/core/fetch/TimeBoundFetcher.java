package com.scrapebatch.core.fetch;

import com.scrapebatch.core.api.FetchException;
import com.scrapebatch.core.api.PageFetcher;
import com.scrapebatch.core.util.NamedThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * fetch 하나에 상한 시간을 건다. 넘으면 작업을 인터럽트하고 FetchException.
 * 멈춘 fetch가 슬롯을 영원히 잡고 있지 못하게 하는 용도.
 */
public final class TimeBoundFetcher implements PageFetcher, AutoCloseable {
    private final PageFetcher delegate;
    private final Duration timeout;
    private final ExecutorService exec;

    public TimeBoundFetcher(PageFetcher delegate, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be > 0");
        this.exec = Executors.newCachedThreadPool(new NamedThreadFactory("fetch"));
    }

    @Override
    public String fetch(String url) throws FetchException, InterruptedException {
        Future<String> f = exec.submit(() -> delegate.fetch(url));
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new FetchException(url, "fetch timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            f.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable c = e.getCause();
            if (c instanceof FetchException fe) throw fe;
            if (c instanceof RuntimeException re) throw re;
            if (c instanceof Error err) throw err;
            // delegate 내부 인터럽트(InterruptedException) 등
            throw new FetchException(url, String.valueOf(c), c);
        }
    }

    @Override
    public void close() {
        exec.shutdownNow();
    }
}
