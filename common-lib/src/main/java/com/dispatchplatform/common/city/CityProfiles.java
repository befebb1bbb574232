package com.dispatchplatform.common.city;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Built-in city profiles keyed by city id. */
public final class CityProfiles {

    public static final CityProfile NYC = new CityProfile(
        "nyc",
        "New York City",
        "NYC",
        List.of("Manhattan", "Brooklyn", "Bronx", "Queens", "Staten Island"),
        List.of("Times Square", "Penn Station", "Grand Central", "Port Authority", "Lincoln Tunnel",
                "Holland Tunnel", "Brooklyn Bridge", "Manhattan Bridge", "Williamsburg Bridge",
                "Central Park", "Prospect Park", "Harlem", "SoHo", "Tribeca", "Chinatown"),
        "NYC street topology - one-ways, dead ends, bridge/tunnel access",
        "NYPD",
        "NYPD police radio dispatch with locations. 10-4, 10-13, 10-85, K, forthwith, precinct, sector, "
            + "central, responding. Addresses like 123 Main Street, intersections like 42nd and Lex, "
            + "landmarks like Times Square, Penn Station.",
        """
            1. Street addresses: "123 West 45th Street" -> "123 W 45th St"
            2. Intersections: "42nd and Lexington" -> "42nd St & Lexington Ave"
            3. Landmarks: Times Square, Penn Station, Grand Central, Port Authority -> landmark name
            4. Precinct references: "the 7-5", "75 precinct", "seven-five" -> location "75th Precinct", borough Brooklyn
            5. Sector designations (Adam, Boy, Charlie) with location context
            6. Highways: "FDR at 96th", "BQE", "Cross Bronx" -> highway location
            Precincts: 1-34 Manhattan, 40-52 Bronx, 60-94 Brooklyn, 100-115 Queens, 120-123 Staten Island.""",
        true,
        "nypd"
    );

    public static final CityProfile MPLS = new CityProfile(
        "mpls",
        "Minneapolis",
        "MPLS",
        List.of("Downtown", "North", "Northeast", "Southeast", "South", "Southwest", "Calhoun-Isles",
                "Camden", "Near North", "Phillips", "Powderhorn", "Nokomis", "Longfellow"),
        List.of("Target Center", "US Bank Stadium", "Mall of America", "Minneapolis Convention Center",
                "Hennepin Avenue", "Lake Street", "Nicollet Mall", "Stone Arch Bridge",
                "University of Minnesota", "Minneapolis-Saint Paul Airport", "Lake Calhoun", "Lake Harriet"),
        "Minneapolis street grid - Lake Street, Hennepin Ave, I-35W, I-94",
        "Minneapolis/Hennepin County",
        "Minneapolis police and fire radio dispatch. Squad, engine, medic, responding, en route. "
            + "Locations like Lake Street and Hennepin Avenue, Nicollet Mall, I-35W, I-94.",
        """
            1. Street addresses: "123 Lake Street" -> "123 Lake St"
            2. Intersections: "Hennepin and Lake", "Franklin and Lyndale" -> "Hennepin Ave & Lake St"
            3. Landmarks: Target Center, US Bank Stadium, Mall of America, Nicollet Mall
            4. Highways: I-35W, I-94, I-494, Highway 55
            5. Neighborhoods: Uptown, Downtown, North Minneapolis, Northeast, Phillips, Powderhorn
            Precincts: 1st Downtown/North Loop, 2nd Northeast, 3rd South (Lake St, Powderhorn, Longfellow),
            4th North, 5th Southwest (Uptown, Calhoun, Lyndale).""",
        false,
        "mnhennco"
    );

    private static final Map<String, CityProfile> BY_ID = Map.of(NYC.id(), NYC, MPLS.id(), MPLS);

    private CityProfiles() {}

    public static Optional<CityProfile> find(String cityId) {
        return Optional.ofNullable(cityId == null ? null : BY_ID.get(cityId));
    }

    public static CityProfile require(String cityId) {
        return find(cityId).orElseThrow(() -> new IllegalArgumentException("Unknown city: " + cityId));
    }

    public static List<CityProfile> all() {
        return List.of(NYC, MPLS);
    }
}
