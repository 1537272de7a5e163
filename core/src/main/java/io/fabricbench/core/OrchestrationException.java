package io.fabricbench.core;

/**
 * A required phase did not succeed; the remaining phases are skipped.
 */
public class OrchestrationException extends Exception {
   private final OrchestrationPhase phase;

   public OrchestrationException(OrchestrationPhase phase, String message) {
      super(message);
      this.phase = phase;
   }

   public OrchestrationPhase phase() {
      return phase;
   }
}
