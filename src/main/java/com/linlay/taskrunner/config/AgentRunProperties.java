package com.linlay.taskrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.run")
public class AgentRunProperties {

    private String systemPrompt = "You are a capable task-execution assistant. Use tools when they help. "
            + "Only call plan_create when the task really needs three or more steps across different tools.";
    private int recursionLimit = 50;
    private int executorRecursionLimit = 30;
    private int planMaxSteps = 20;
    private boolean planRevisionEnabled = true;
    private boolean planRequireApproval = false;
    private long approvalTimeoutMs = 0;
    private UnattendedApproval unattendedApproval = UnattendedApproval.WAIT;
    private int stepResultMaxChars = 1000;
    private int stepSummaryMaxChars = 300;
    private int replanSummaryMaxChars = 200;
    private int debugInputMaxChars = 5000;
    private String reasoningOpenMarker = "<think>";
    private String reasoningCloseMarker = "</think>";

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public int getRecursionLimit() {
        return recursionLimit;
    }

    public void setRecursionLimit(int recursionLimit) {
        this.recursionLimit = recursionLimit;
    }

    public int getExecutorRecursionLimit() {
        return executorRecursionLimit;
    }

    public void setExecutorRecursionLimit(int executorRecursionLimit) {
        this.executorRecursionLimit = executorRecursionLimit;
    }

    public int getPlanMaxSteps() {
        return planMaxSteps;
    }

    public void setPlanMaxSteps(int planMaxSteps) {
        this.planMaxSteps = planMaxSteps;
    }

    public boolean isPlanRevisionEnabled() {
        return planRevisionEnabled;
    }

    public void setPlanRevisionEnabled(boolean planRevisionEnabled) {
        this.planRevisionEnabled = planRevisionEnabled;
    }

    public boolean isPlanRequireApproval() {
        return planRequireApproval;
    }

    public void setPlanRequireApproval(boolean planRequireApproval) {
        this.planRequireApproval = planRequireApproval;
    }

    public long getApprovalTimeoutMs() {
        return approvalTimeoutMs;
    }

    public void setApprovalTimeoutMs(long approvalTimeoutMs) {
        this.approvalTimeoutMs = approvalTimeoutMs;
    }

    public UnattendedApproval getUnattendedApproval() {
        return unattendedApproval;
    }

    public void setUnattendedApproval(UnattendedApproval unattendedApproval) {
        this.unattendedApproval = unattendedApproval == null ? UnattendedApproval.WAIT : unattendedApproval;
    }

    public int getStepResultMaxChars() {
        return stepResultMaxChars;
    }

    public void setStepResultMaxChars(int stepResultMaxChars) {
        this.stepResultMaxChars = stepResultMaxChars;
    }

    public int getStepSummaryMaxChars() {
        return stepSummaryMaxChars;
    }

    public void setStepSummaryMaxChars(int stepSummaryMaxChars) {
        this.stepSummaryMaxChars = stepSummaryMaxChars;
    }

    public int getReplanSummaryMaxChars() {
        return replanSummaryMaxChars;
    }

    public void setReplanSummaryMaxChars(int replanSummaryMaxChars) {
        this.replanSummaryMaxChars = replanSummaryMaxChars;
    }

    public int getDebugInputMaxChars() {
        return debugInputMaxChars;
    }

    public void setDebugInputMaxChars(int debugInputMaxChars) {
        this.debugInputMaxChars = debugInputMaxChars;
    }

    public String getReasoningOpenMarker() {
        return reasoningOpenMarker;
    }

    public void setReasoningOpenMarker(String reasoningOpenMarker) {
        this.reasoningOpenMarker = reasoningOpenMarker;
    }

    public String getReasoningCloseMarker() {
        return reasoningCloseMarker;
    }

    public void setReasoningCloseMarker(String reasoningCloseMarker) {
        this.reasoningCloseMarker = reasoningCloseMarker;
    }

    /**
     * What happens to a plan nobody approves or rejects within {@code approval-timeout-ms}.
     * {@link #WAIT} ignores the timeout and suspends until the request is resolved or cancelled.
     */
    public enum UnattendedApproval {
        WAIT,
        REJECT,
        APPROVE
    }
}
