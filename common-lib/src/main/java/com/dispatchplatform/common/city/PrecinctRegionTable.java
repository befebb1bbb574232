package com.dispatchplatform.common.city;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** NYPD precinct number to borough. */
public final class PrecinctRegionTable {

    private static final Map<Integer, String> PRECINCT_TO_BOROUGH = new HashMap<>();

    static {
        register("Manhattan", 1, 5, 6, 7, 9, 10, 13, 14, 17, 18, 19, 20, 22, 23, 24, 25, 26, 28, 30, 32, 33, 34);
        register("Bronx", 40, 41, 42, 43, 44, 45, 46, 47, 48, 49, 50, 52);
        register("Brooklyn", 60, 61, 62, 63, 66, 67, 68, 69, 70, 71, 72, 73, 75, 76, 77, 78, 79,
                 81, 83, 84, 88, 90, 94);
        register("Queens", 100, 101, 102, 103, 104, 105, 106, 107, 108, 109, 110, 111, 112, 113, 114, 115);
        register("Staten Island", 120, 121, 122, 123);
    }

    private PrecinctRegionTable() {}

    /**
     * Looks up the borough for a precinct reference such as {@code "75"}, {@code "75th"} or
     * {@code "the 75"}. Non-digits are ignored.
     */
    public static Optional<String> regionFor(String precinct) {
        return number(precinct).map(PRECINCT_TO_BOROUGH::get);
    }

    /** Area label for a precinct reference: {@code "the 1"} becomes {@code "1st Precinct area"}. */
    public static Optional<String> areaName(String precinct) {
        return number(precinct).map(n -> ordinal(n) + " Precinct area");
    }

    static String ordinal(int n) {
        int lastTwo = n % 100;
        if (lastTwo >= 11 && lastTwo <= 13) return n + "th";
        switch (n % 10) {
            case 1:  return n + "st";
            case 2:  return n + "nd";
            case 3:  return n + "rd";
            default: return n + "th";
        }
    }

    private static Optional<Integer> number(String precinct) {
        if (precinct == null) return Optional.empty();
        String digits = precinct.replaceAll("\\D", "");
        if (digits.isEmpty() || digits.length() > 4) return Optional.empty();
        return Optional.of(Integer.parseInt(digits));
    }

    private static void register(String borough, int... precincts) {
        for (int p : precincts) {
            PRECINCT_TO_BOROUGH.put(p, borough);
        }
    }
}
