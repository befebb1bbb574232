package com.dispatchplatform.common.city;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PrecinctRegionTableTest {

    @Test
    @DisplayName("maps precinct references to boroughs, ignoring non-digits")
    void lookup() {
        assertEquals(Optional.of("Brooklyn"), PrecinctRegionTable.regionFor("75"));
        assertEquals(Optional.of("Brooklyn"), PrecinctRegionTable.regionFor("75th"));
        assertEquals(Optional.of("Manhattan"), PrecinctRegionTable.regionFor("the 1"));
        assertEquals(Optional.of("Queens"), PrecinctRegionTable.regionFor("115"));
        assertEquals(Optional.of("Staten Island"), PrecinctRegionTable.regionFor("122"));
    }

    @Test
    @DisplayName("unknown or missing precincts map to nothing")
    void unknown() {
        assertTrue(PrecinctRegionTable.regionFor("51").isEmpty());
        assertTrue(PrecinctRegionTable.regionFor("none").isEmpty());
        assertTrue(PrecinctRegionTable.regionFor(null).isEmpty());
    }

    @Test
    @DisplayName("built-in profiles are addressable by id")
    void profiles() {
        assertTrue(CityProfiles.require("nyc").usesPrecinctTable());
        assertFalse(CityProfiles.require("mpls").usesPrecinctTable());
        assertTrue(CityProfiles.find("sf").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> CityProfiles.require("sf"));
    }

    @Test
    @DisplayName("area names carry the right ordinal suffix")
    void areaNames() {
        assertEquals("1st Precinct area", PrecinctRegionTable.areaName("the 1").orElseThrow());
        assertEquals("2nd Precinct area", PrecinctRegionTable.areaName("2").orElseThrow());
        assertEquals("23rd Precinct area", PrecinctRegionTable.areaName("23rd").orElseThrow());
        assertEquals("75th Precinct area", PrecinctRegionTable.areaName("75").orElseThrow());
        assertEquals("112th Precinct area", PrecinctRegionTable.areaName("112").orElseThrow());
        assertEquals("121st Precinct area", PrecinctRegionTable.areaName("121").orElseThrow());
        assertTrue(PrecinctRegionTable.areaName("the seven-five").isEmpty());
    }
}
