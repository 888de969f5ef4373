package com.project.hatchmark.workflow;

/**
 * The workflow was abandoned before anything was signed. Nothing reached the ledger.
 */
public class WorkflowCancelledException extends RuntimeException {

    public WorkflowCancelledException(String step) {
        super("workflow cancelled before " + step);
    }
}
