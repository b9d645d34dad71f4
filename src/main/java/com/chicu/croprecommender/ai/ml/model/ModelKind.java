package com.chicu.croprecommender.ai.ml.model;

public enum ModelKind {
    GRADIENT_BOOSTING("Gradient Tree Boosting Classifier", true),
    LOGISTIC_REGRESSION("Multinomial Logistic Regression", false);

    private final String displayName;
    private final boolean exposesImportance;

    ModelKind(String displayName, boolean exposesImportance) {
        this.displayName = displayName;
        this.exposesImportance = exposesImportance;
    }

    public String displayName() {
        return displayName;
    }

    public boolean exposesImportance() {
        return exposesImportance;
    }
}
