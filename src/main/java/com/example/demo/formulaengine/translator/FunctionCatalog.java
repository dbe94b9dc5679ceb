package com.example.demo.formulaengine.translator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static table of Excel functions supported by the runtime module.
 *
 * Every target is named xl_&lt;name&gt; with dots turned into underscores (STDEV.S becomes
 * xl_stdev_s). Names missing from the table get the same target name by the same rule, so
 * a script can still run once the helper is added to the runtime.
 */
public final class FunctionCatalog {

    private static final Map<String, FunctionSpec> FUNCTIONS;

    static {
        Map<String, FunctionSpec> map = new LinkedHashMap<>();
        // math
        register(map,
                "SUM", "PRODUCT", "ABS", "ROUND", "ROUNDUP", "ROUNDDOWN", "MROUND", "INT", "TRUNC",
                "MOD", "POWER", "SQRT", "LN", "LOG", "LOG10", "EXP", "SIGN", "PI", "CEILING",
                "CEILING.MATH", "FLOOR", "FLOOR.MATH", "EVEN", "ODD", "SUMPRODUCT", "SUMSQ");
        // statistical
        register(map,
                "AVERAGE", "AVERAGEA", "COUNT", "COUNTA", "COUNTBLANK", "MIN", "MAX", "MEDIAN",
                "STDEV", "STDEV.S", "STDEV.P", "VAR", "VAR.S", "VAR.P", "LARGE", "SMALL",
                "RANK", "RANK.EQ");
        // conditional aggregates
        register(map,
                "SUMIF", "SUMIFS", "COUNTIF", "COUNTIFS", "AVERAGEIF", "AVERAGEIFS", "MAXIFS", "MINIFS");
        // logical
        register(map,
                "IF", "IFS", "IFERROR", "IFNA", "AND", "OR", "NOT", "XOR", "SWITCH", "TRUE", "FALSE");
        // information
        register(map,
                "ISERROR", "ISERR", "ISNA", "ISBLANK", "ISNUMBER", "ISTEXT", "ISLOGICAL", "NA", "N");
        // lookup and reference
        register(map,
                "VLOOKUP", "HLOOKUP", "XLOOKUP", "LOOKUP", "INDEX", "MATCH", "CHOOSE", "ROW",
                "COLUMN", "ROWS", "COLUMNS", "TRANSPOSE");
        // text
        register(map,
                "LEFT", "RIGHT", "MID", "LEN", "TRIM", "UPPER", "LOWER", "PROPER", "CONCATENATE",
                "CONCAT", "TEXTJOIN", "TEXT", "VALUE", "FIND", "SEARCH", "SUBSTITUTE", "REPLACE",
                "REPT", "EXACT");
        // date and time
        register(map,
                "DATE", "YEAR", "MONTH", "DAY", "TODAY", "NOW", "EDATE", "EOMONTH", "DAYS",
                "WEEKDAY", "YEARFRAC");
        // financial
        register(map,
                "NPV", "IRR", "XNPV", "XIRR", "PMT", "PPMT", "IPMT", "PV", "FV", "NPER", "RATE");
        // resolved against the cell store at run time
        register(map, "OFFSET", "INDIRECT");
        FUNCTIONS = Collections.unmodifiableMap(map);
    }

    private FunctionCatalog() {
    }

    private static void register(Map<String, FunctionSpec> map, String... names) {
        for (String name : names) {
            map.put(name, new FunctionSpec(targetNameFor(name)));
        }
    }

    /**
     * Upper-cases a function name and strips the "_xlfn." / "_xlws." prefixes that newer
     * functions carry in the file format.
     */
    public static String normalize(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        if (upper.startsWith("_XLFN.")) {
            upper = upper.substring(6);
        }
        if (upper.startsWith("_XLWS.")) {
            upper = upper.substring(6);
        }
        return upper;
    }

    public static String targetNameFor(String normalizedName) {
        return "xl_" + normalizedName.toLowerCase(Locale.ROOT).replace('.', '_');
    }

    /** Spec for a known function, null when the name is not in the table */
    public static FunctionSpec lookup(String name) {
        return FUNCTIONS.get(normalize(name));
    }
}
