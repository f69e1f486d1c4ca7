package com.wayq.query;

public final class RoadFilters {

    // roads and paths in use
    public static final String DEFAULT = "is_tag(highway)"
            + " and highway not in ['proposed','corridor','construction','footway','steps','busway','elevator','services']"
            + " and service not in ['driveway','parking_aisle']"
            + " and area != 'yes'";

    private RoadFilters() {
    }
}
