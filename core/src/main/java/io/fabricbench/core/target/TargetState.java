package io.fabricbench.core.target;

public enum TargetState {
   UNCONFIGURED,
   MODULES_LOADED,
   SUBSYSTEM_CREATED,
   NAMESPACES_ENABLED,
   PORT_BOUND,
   VERIFIED,
   CLEANED_UP
}
