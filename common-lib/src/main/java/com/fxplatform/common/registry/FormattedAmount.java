package com.fxplatform.common.registry;

import java.math.BigDecimal;

public record FormattedAmount(BigDecimal amount, String formatted, String currency, String symbol) {}
