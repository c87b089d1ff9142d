package com.fleet.resolution.core.model;

/**
 * How a scale set manages its virtual machines.
 */
public enum OrchestrationMode {
    /** VMs are stamped from a common model and managed as a group. */
    UNIFORM,
    /** VMs are managed individually. */
    FLEXIBLE
}
