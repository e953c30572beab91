package com.findex.backend.service.aws;

import com.findex.backend.config.AwsSettings;
import com.findex.backend.exception.ExportCancelledException;
import com.findex.backend.exception.ExportException;
import com.findex.backend.exception.RemoteServiceException;
import com.findex.backend.util.CancellationToken;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Every EC2 and GuardDuty request goes through here. The guard throttles the
 * request, bounds it by the call deadline, abandons it on cancellation and
 * records its latency. Failures are translated into
 * {@link RemoteServiceException} and never retried.
 */
@Slf4j
@Component
public class AwsCallGuard {

    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;
    private final ExecutorService callExecutor;
    private final Duration deadline;

    public AwsCallGuard(RateLimiter awsRateLimiter,
                        MeterRegistry meterRegistry,
                        @Qualifier("awsCallExecutor") ExecutorService awsCallExecutor,
                        AwsSettings settings) {
        this.rateLimiter = awsRateLimiter;
        this.meterRegistry = meterRegistry;
        this.callExecutor = awsCallExecutor;
        this.deadline = settings.callTimeout();
    }

    public <T> T call(String operation, String region, CancellationToken cancellation, Supplier<T> request) {
        cancellation.throwIfCancelled();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            if (!rateLimiter.acquirePermission()) {
                throw new RemoteServiceException(operation, region, 429, "client-side rate limit exhausted", null);
            }
            cancellation.throwIfCancelled();
            T result = await(operation, region, cancellation, callExecutor.submit(request::get));
            status = "success";
            return result;
        } catch (ExportCancelledException e) {
            status = "cancelled";
            throw e;
        } catch (RemoteServiceException e) {
            log.warn("AWS call failed operation={} region={} status={} message={}",
                    operation, region, e.getStatusCode(), e.getMessage());
            throw e;
        } finally {
            sample.stop(Timer.builder("aws_call_latency")
                    .tag("operation", operation)
                    .tag("status", status)
                    .register(meterRegistry));
        }
    }

    private <T> T await(String operation, String region, CancellationToken cancellation, Future<T> future) {
        Runnable unregister = cancellation.onCancel(() -> future.cancel(true));
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RemoteServiceException(operation, region, "no response within " + deadline.toMillis() + " ms", e);
        } catch (CancellationException e) {
            throw new ExportCancelledException("Export cancelled during " + operation + " in " + region);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExportCancelledException("Interrupted during " + operation + " in " + region);
        } catch (ExecutionException e) {
            throw translate(operation, region, cancellation, e.getCause());
        } finally {
            unregister.run();
        }
    }

    ExportException translate(String operation, String region, CancellationToken cancellation, Throwable cause) {
        if (cause instanceof ExportException exportException) {
            return exportException;
        }
        if (cause instanceof AbortedException && cancellation.isCancelled()) {
            return new ExportCancelledException("Export cancelled during " + operation + " in " + region);
        }
        if (cause instanceof AwsServiceException serviceException) {
            String detail = serviceException.awsErrorDetails() != null
                    ? serviceException.awsErrorDetails().errorCode() + ": " + serviceException.awsErrorDetails().errorMessage()
                    : serviceException.getMessage();
            return new RemoteServiceException(operation, region, serviceException.statusCode(), detail, serviceException);
        }
        if (cause instanceof ApiCallTimeoutException) {
            return new RemoteServiceException(operation, region, "no response within " + deadline.toMillis() + " ms", cause);
        }
        if (cause instanceof SdkClientException) {
            return new RemoteServiceException(operation, region, "client error: " + cause.getMessage(), cause);
        }
        if (cause instanceof SdkException) {
            return new RemoteServiceException(operation, region, cause.getMessage(), cause);
        }
        return new RemoteServiceException(operation, region, "unexpected response: " + cause, cause);
    }
}
