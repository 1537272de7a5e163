package io.fabricbench.core.benchmark;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import io.fabricbench.api.session.RemoteSession;

/**
 * One entry of the benchmark battery: a single <code>fio</code> job against the connected device.
 */
public class BenchmarkSpec {
   /**
    * Time added on top of the requested runtime before the remote execution is considered hung.
    */
   public static final long RUNTIME_GRACE_SECONDS = 60;

   public static final List<BenchmarkSpec> DEFAULT_BATTERY = List.of(
         sized("seq_read", "read", "1M", "1G"),
         timed("rand_read", "randread", "4k", 60),
         timed("rand_write", "randwrite", "4k", 60),
         timed("randrw", "randrw", "4k", 60).readMix(70));

   public final String name;
   public final String mode;
   public final String blockSize;
   public final String size;
   public final Integer runtime;
   public final Integer readMixPercent;

   public BenchmarkSpec(String name, String mode, String blockSize, String size, Integer runtime, Integer readMixPercent) {
      if (name == null || name.isEmpty()) {
         throw new IllegalArgumentException("Benchmark name must be set");
      }
      if (runtime != null && runtime <= 0) {
         throw new IllegalArgumentException("Runtime of " + name + " must be positive: " + runtime);
      }
      if (readMixPercent != null && (readMixPercent < 0 || readMixPercent > 100)) {
         throw new IllegalArgumentException("Read mix of " + name + " must be within 0-100: " + readMixPercent);
      }
      this.name = name;
      this.mode = mode;
      this.blockSize = blockSize;
      this.size = size;
      this.runtime = runtime;
      this.readMixPercent = readMixPercent;
   }

   public static BenchmarkSpec sized(String name, String mode, String blockSize, String size) {
      return new BenchmarkSpec(name, mode, blockSize, size, null, null);
   }

   public static BenchmarkSpec timed(String name, String mode, String blockSize, int runtimeSeconds) {
      return new BenchmarkSpec(name, mode, blockSize, null, runtimeSeconds, null);
   }

   public BenchmarkSpec readMix(int percent) {
      return new BenchmarkSpec(name, mode, blockSize, size, runtime, percent);
   }

   public long timeoutMillis() {
      if (runtime == null) {
         return RemoteSession.DEFAULT_TIMEOUT;
      }
      return TimeUnit.SECONDS.toMillis(runtime + RUNTIME_GRACE_SECONDS);
   }

   public List<String> fioOptions(String device) {
      List<String> options = new ArrayList<>();
      options.add("--name=" + name);
      options.add("--filename=" + device);
      options.add("--rw=" + mode);
      options.add("--bs=" + blockSize);
      options.add("--direct=1");
      options.add("--output-format=json");
      if (size != null) {
         options.add("--size=" + size);
      }
      if (runtime != null) {
         options.add("--runtime=" + runtime);
      }
      if (readMixPercent != null) {
         options.add("--rwmixread=" + readMixPercent);
      }
      return options;
   }

   @Override
   public String toString() {
      return name + " (" + mode + ", " + blockSize + ")";
   }
}
