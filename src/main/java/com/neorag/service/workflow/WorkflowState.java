package com.neorag.service.workflow;

/**
 * Steps of a query run: ROUTE, then VECTOR or HYBRID, then GENERATE, then DONE.
 */
public enum WorkflowState {
    ROUTE,
    VECTOR,
    HYBRID,
    GENERATE,
    DONE
}
