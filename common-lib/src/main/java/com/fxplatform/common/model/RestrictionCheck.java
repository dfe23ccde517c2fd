package com.fxplatform.common.model;

import java.util.List;

public record RestrictionCheck(boolean allowed, boolean requiresCompliance, List<String> reasons) {

    public static RestrictionCheck unrestricted() {
        return new RestrictionCheck(true, false, List.of());
    }
}
