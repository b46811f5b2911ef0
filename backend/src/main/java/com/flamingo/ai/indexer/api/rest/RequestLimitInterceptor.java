package com.flamingo.ai.indexer.api.rest;

import com.flamingo.ai.indexer.exception.RequestLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.Semaphore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.HandlerInterceptor;

/** Caps the number of requests a handler serves at the same time. Excess requests are rejected. */
@Slf4j
public class RequestLimitInterceptor implements HandlerInterceptor {

  private static final String PERMIT_ATTRIBUTE =
      RequestLimitInterceptor.class.getName() + ".permit";

  private final Semaphore permits;
  private final int limit;

  public RequestLimitInterceptor(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("Concurrent request limit must be positive: " + limit);
    }
    this.limit = limit;
    this.permits = new Semaphore(limit);
  }

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    if (!permits.tryAcquire()) {
      throw new RequestLimitExceededException(limit);
    }
    request.setAttribute(PERMIT_ATTRIBUTE, Boolean.TRUE);
    log.trace("Acquired request permit, {} left", permits.availablePermits());
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
    if (request.getAttribute(PERMIT_ATTRIBUTE) != null) {
      request.removeAttribute(PERMIT_ATTRIBUTE);
      permits.release();
    }
  }

  int availablePermits() {
    return permits.availablePermits();
  }
}
