package com.fxplatform.common.registry;

import com.fxplatform.common.model.CurrencyCategory;
import com.fxplatform.common.model.CurrencyDefinition;
import com.fxplatform.common.model.RegionalRestriction;
import com.fxplatform.common.model.TradingHours;

import java.util.List;
import java.util.Set;

/**
 * Bootstrap catalog: ten ISO 4217 currencies and the default regional restrictions.
 */
final class DefaultCurrencies {

    static final List<String> CODES =
        List.of("USD", "EUR", "GBP", "JPY", "CAD", "AUD", "CHF", "CNY", "SEK", "NZD");

    private DefaultCurrencies() {}

    static List<CurrencyDefinition> definitions() {
        TradingHours allDay = TradingHours.allDay();
        return List.of(
            def("USD", "US Dollar",              "$",   2, 840, "cent",   List.of("US"), allDay, CurrencyCategory.MAJOR),
            def("EUR", "Euro",                   "€",   2, 978, "cent",
                List.of("DE", "FR", "IT", "ES", "NL", "BE", "AT", "PT", "IE", "FI", "GR", "LU",
                        "SI", "CY", "MT", "SK", "EE", "LV", "LT"), allDay, CurrencyCategory.MAJOR),
            def("GBP", "British Pound Sterling", "£",   2, 826, "penny",  List.of("GB"), allDay, CurrencyCategory.MAJOR),
            def("JPY", "Japanese Yen",           "¥",   0, 392, "sen",    List.of("JP"), allDay, CurrencyCategory.MAJOR),
            def("CAD", "Canadian Dollar",        "C$",  2, 124, "cent",   List.of("CA"), allDay, CurrencyCategory.MAJOR),
            def("AUD", "Australian Dollar",      "A$",  2,  36, "cent",   List.of("AU"), allDay, CurrencyCategory.MAJOR),
            def("CHF", "Swiss Franc",            "CHF", 2, 756, "rappen", List.of("CH", "LI"), allDay, CurrencyCategory.MAJOR),
            def("CNY", "Chinese Yuan",           "¥",   2, 156, "jiao",   List.of("CN"),
                TradingHours.of("01:30", "08:30"), CurrencyCategory.EMERGING),
            def("SEK", "Swedish Krona",          "kr",  2, 752, "öre",    List.of("SE"), allDay, CurrencyCategory.MINOR),
            def("NZD", "New Zealand Dollar",     "NZ$", 2, 554, "cent",   List.of("NZ"), allDay, CurrencyCategory.MINOR)
        );
    }

    static List<RegionalRestriction> restrictions() {
        return List.of(
            new RegionalRestriction("US", Set.of(), true),
            new RegionalRestriction("EU", Set.of(), true),
            new RegionalRestriction("CN", Set.of("USD"), true),
            new RegionalRestriction("RU", Set.of("USD", "EUR"), true)
        );
    }

    private static CurrencyDefinition def(String code, String name, String symbol, int decimals,
                                          int numeric, String minorUnit, List<String> countries,
                                          TradingHours hours, CurrencyCategory category) {
        return new CurrencyDefinition(code, name, symbol, decimals, numeric, minorUnit,
                                      countries, hours, category, false);
    }
}
