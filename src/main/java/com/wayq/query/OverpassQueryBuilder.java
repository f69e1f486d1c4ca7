package com.wayq.query;

import com.wayq.geo.Circle;
import com.wayq.geo.Decimals;

/**
 * Assembles criteria into an Overpass QL query for the ways around a region. Each criterion becomes its
 * own statement; the statements are unioned.
 */
public class OverpassQueryBuilder {
    static final String PREAMBLE = "[out:json];(";
    static final String EPILOGUE = ");out tags geom qt;";

    public String build(Circle region, Iterable<String> criteria) {
        String around = "way(around:" + Decimals.format(region.radius())
                + "," + Decimals.format(region.lat())
                + "," + Decimals.format(region.lon()) + ")";

        StringBuilder sb = new StringBuilder(PREAMBLE);
        for (String criterion : criteria) {
            sb.append(around).append(criterion).append(';');
        }
        return sb.append(EPILOGUE).toString();
    }
}
