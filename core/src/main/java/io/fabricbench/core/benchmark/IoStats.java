package io.fabricbench.core.benchmark;

import io.vertx.core.json.JsonObject;

/**
 * Totals of one I/O direction of a <code>fio</code> job.
 */
public class IoStats {
   public final long ioBytes;
   // fio reports bandwidth in KiB/s
   public final double bandwidth;
   public final double iops;

   public IoStats(long ioBytes, double bandwidth, double iops) {
      this.ioBytes = ioBytes;
      this.bandwidth = bandwidth;
      this.iops = iops;
   }

   static IoStats from(JsonObject object) {
      if (object == null) {
         return null;
      }
      return new IoStats(number(object, "io_bytes").longValue(), number(object, "bw").doubleValue(), number(object, "iops").doubleValue());
   }

   private static Number number(JsonObject object, String field) {
      Object value = object.getValue(field);
      return value instanceof Number ? (Number) value : 0;
   }

   public boolean hasTraffic() {
      return ioBytes > 0;
   }

   public double megabytesPerSecond() {
      return bandwidth / 1024;
   }
}
