package com.ospicorp.capacityforecast.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/** Runs independent units on the caller's executor and waits for all of them. */
public final class UnitExecution {
  private UnitExecution() {
  }

  public static <T> List<T> runAll(List<Supplier<T>> units, Executor executor) {
    List<CompletableFuture<T>> futures = new ArrayList<>(units.size());
    for (Supplier<T> unit : units) {
      futures.add(CompletableFuture.supplyAsync(unit, executor));
    }
    List<T> results = new ArrayList<>(futures.size());
    for (CompletableFuture<T> future : futures) {
      try {
        results.add(future.join());
      } catch (CompletionException ex) {
        if (ex.getCause() instanceof RuntimeException runtime) {
          throw runtime;
        }
        if (ex.getCause() instanceof Error error) {
          throw error;
        }
        throw ex;
      }
    }
    return results;
  }
}
