/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
 
package io.permaudit.retry;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;

import io.permaudit.config.AuditSettings;
import io.permaudit.model.exception.ErrorCode;
import io.permaudit.model.exception.InternalException;

/**
 * Runs remote calls with a timeout per attempt and a bounded number of attempts with exponential
 * backoff. Failures with a permanent {@link ErrorCode} are rethrown at once; all other failures
 * are retried, and the last one is handed to a {@link FailureFactory} when attempts run out.
 *
 * <p>Attempts run on a single worker thread so that the timeout can be enforced. The caller waits
 * for every attempt, so calls stay sequential.
 */
@Log4j2
public class ServiceCallPolicy implements Closeable {
  private final Retry retry;
  private final TimeLimiter timeLimiter;
  private final ExecutorService executor;

  /** Creates the exception raised when a call finally fails. {@code errorCode} may be null. */
  @FunctionalInterface
  public interface FailureFactory {
    RuntimeException create(ErrorCode errorCode, String message, Throwable cause);
  }

  public ServiceCallPolicy(String name, AuditSettings.RetrySettings settings) {
    RetryConfig retryConfig =
        RetryConfig.custom()
            .maxAttempts(settings.getMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    Duration.ofMillis(Math.max(1L, settings.getInitialBackoffMillis())),
                    settings.getBackoffMultiplier()))
            .retryOnException(ServiceCallPolicy::isRetryable)
            .build();
    this.retry = Retry.of(name, retryConfig);
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "{} call failed (attempt {}), retrying in {}: {}",
                    name,
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(),
                    event.getLastThrowable() == null ? "" : event.getLastThrowable().toString()));
    this.timeLimiter =
        TimeLimiter.of(
            name,
            TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .cancelRunningFuture(true)
                .build());
    this.executor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, name + "-call");
              thread.setDaemon(true);
              return thread;
            });
  }

  /**
   * Executes {@code call} under this policy.
   *
   * @param operation description of the call for logs and messages
   * @param call the remote call
   * @param failureFactory creates the exception raised when the call fails for good
   * @return the result of the first successful attempt
   */
  public <T> T execute(String operation, Supplier<T> call, FailureFactory failureFactory) {
    Callable<T> timed =
        TimeLimiter.decorateFutureSupplier(
            timeLimiter, () -> executor.submit(call::get));
    Callable<T> retried = Retry.decorateCallable(retry, timed);
    try {
      return retried.call();
    } catch (InternalException e) {
      if (e.getErrorCode().isPermanent()) {
        throw e;
      }
      throw failureFactory.create(e.getErrorCode(), attemptsExhausted(operation), e);
    } catch (TimeoutException e) {
      throw failureFactory.create(ErrorCode.TIMEOUT, attemptsExhausted(operation), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw failureFactory.create(null, operation + " was interrupted", e);
    } catch (Exception e) {
      throw failureFactory.create(null, attemptsExhausted(operation), e);
    }
  }

  static boolean isRetryable(Throwable throwable) {
    if (throwable instanceof InternalException) {
      return !((InternalException) throwable).getErrorCode().isPermanent();
    }
    return true;
  }

  private String attemptsExhausted(String operation) {
    return String.format(
        "%s failed after %d attempts", operation, retry.getRetryConfig().getMaxAttempts());
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
