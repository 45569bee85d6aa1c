package com.ospicorp.forecastengine.forecast.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.forecastengine.forecast.model.QuantileForecast;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SerializingForecastModelTest {

  @Test
  void admitsOneCallAtATime() throws Exception {
    AtomicInteger active = new AtomicInteger();
    AtomicInteger maxActive = new AtomicInteger();
    ForecastModel unsafe = (history, modelName) -> {
      int now = active.incrementAndGet();
      maxActive.accumulateAndGet(now, Math::max);
      try {
        Thread.sleep(20);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      active.decrementAndGet();
      return new QuantileForecast(Set.of(QuantileForecast.MEAN), List.of());
    };
    SerializingForecastModel model = new SerializingForecastModel(unsafe);

    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<QuantileForecast>> calls = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        calls.add(pool.submit(() -> model.predict(Map.of(), "AutoETS")));
      }
      for (Future<QuantileForecast> call : calls) {
        call.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(maxActive.get()).isEqualTo(1);
    assertThat(model.threadSafe()).isTrue();
  }
}
