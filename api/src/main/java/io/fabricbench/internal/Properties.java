package io.fabricbench.internal;

import java.util.function.Function;

public interface Properties {
   String FABRICBENCH_STACKTRACE = "io.fabricbench.stacktrace";
   String COMMAND_TIMEOUT = "io.fabricbench.command.timeout";
   String CONNECT_TIMEOUT = "io.fabricbench.connect.timeout";
   String INITIATOR_PASSWORD = "io.fabricbench.initiator.password";
   String LOG4J2_CONFIGURATION_FILE = "log4j.configurationFile";
   String LOG_LEVEL = "io.fabricbench.log.level";
   String RESULTS_FILE = "io.fabricbench.results.file";
   String SESSION_TRANSPORT = "io.fabricbench.session.transport";
   String SETTLE_DELAY = "io.fabricbench.settle.delay";
   String TARGET_PASSWORD = "io.fabricbench.target.password";

   static String get(String property, String def) {
      return get(property, Function.identity(), def);
   }

   static long getLong(String property, long def) {
      return get(property, Long::valueOf, def);
   }

   static int getInt(String property, int def) {
      return get(property, Integer::valueOf, def);
   }

   static boolean getBoolean(String property) {
      return get(property, Boolean::valueOf, false);
   }

   static <T> T get(String property, Function<String, T> f, T def) {
      String value = System.getProperty(property);
      if (value != null) {
         return f.apply(value);
      }
      value = System.getenv(property.replaceAll("[^a-zA-Z0-9]", "_").toUpperCase());
      if (value != null) {
         return f.apply(value);
      }
      return def;
   }
}
