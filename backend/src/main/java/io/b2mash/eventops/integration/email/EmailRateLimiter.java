package io.b2mash.eventops.integration.email;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Hourly send cap per provider. Counters live in memory and reset an hour after first use. */
@Service
public class EmailRateLimiter {

  private final int hourlyLimit;
  private final Cache<String, AtomicInteger> providerCounters;

  @Autowired
  public EmailRateLimiter(@Value("${eventops.email.rate-limit.hourly:500}") int hourlyLimit) {
    this(hourlyLimit, Ticker.systemTicker());
  }

  EmailRateLimiter(int hourlyLimit, Ticker ticker) {
    this.hourlyLimit = hourlyLimit;
    this.providerCounters =
        Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofHours(1))
            .maximumSize(100)
            .ticker(ticker)
            .build();
  }

  public boolean tryAcquire(String providerSlug) {
    var counter = providerCounters.get("provider:" + providerSlug, k -> new AtomicInteger(0));
    int count = counter.incrementAndGet();
    if (count > hourlyLimit) {
      counter.decrementAndGet();
      return false;
    }
    return true;
  }

  public RateLimitStatus getStatus(String providerSlug) {
    var counter = providerCounters.getIfPresent("provider:" + providerSlug);
    int currentCount = counter != null ? counter.get() : 0;
    return new RateLimitStatus(currentCount, hourlyLimit, currentCount < hourlyLimit);
  }

  public record RateLimitStatus(int currentCount, int limit, boolean allowed) {}
}
