package com.eainde.diagnosis.workflow;

/**
 * Node names of the diagnosis graph. Each is also written to
 * {@link com.eainde.diagnosis.state.DiagnosisState#STAGE} when its node completes.
 */
public final class Stages {

    public static final String VALIDATING = "validating";
    public static final String CLASSIFYING = "classifying";
    public static final String REVIEWING = "reviewing";
    public static final String RECONCILING = "reconciling";
    public static final String SCORING = "scoring";
    public static final String PLANNING = "planning";
    public static final String FAILED = "failed";
    public static final String DONE = "done";

    private Stages() {
    }
}
