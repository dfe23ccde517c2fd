package com.fxplatform.common.validation;

public record ValidationStats(
    long totalValidations,
    long passedValidations,
    long failedValidations,
    long anomaliesDetected,
    long arbitrageOpportunities,
    long cyclesValidated,
    double averageQualityScore,
    int historySize
) {}
