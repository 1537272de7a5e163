package io.fabricbench.core;

public enum OrchestrationPhase {
   NOT_STARTED(0, "Not started"),
   TARGET_SETUP(1, "Setting up target"),
   TARGET_VERIFY(2, "Verifying target"),
   DISCOVER(3, "Discovering target from initiator"),
   CONNECT(4, "Connecting to target"),
   BENCHMARK(5, "Running I/O tests"),
   DISCONNECT(6, "Disconnecting"),
   SUMMARY(7, "Test results summary"),
   CLEANUP(8, "Cleaning up target");

   public final int number;
   public final String description;

   OrchestrationPhase(int number, String description) {
      this.number = number;
      this.description = description;
   }

   @Override
   public String toString() {
      return this == CLEANUP ? "[Cleanup] " + description : "[Phase " + number + "] " + description;
   }
}
