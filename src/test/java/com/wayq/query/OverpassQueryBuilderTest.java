package com.wayq.query;

import com.wayq.geo.Circle;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OverpassQueryBuilderTest {
    private final OverpassQueryBuilder builder = new OverpassQueryBuilder();

    @Test
    public void testSingleCriterion() {
        String query = builder.build(new Circle(-37.8, 144.9, 10000), Lists.mutable.with("[highway]"));
        assertEquals("[out:json];(way(around:10000,-37.8,144.9)[highway];);out tags geom qt;", query);
    }

    @Test
    public void testEachCriterionIsAStatement() {
        String query = builder.build(new Circle(51.5, -0.12, 250),
                Lists.mutable.with("[highway=\"primary\"]", "(if:t[\"lanes\"]>2)"));
        assertEquals("[out:json];("
                + "way(around:250,51.5,-0.12)[highway=\"primary\"];"
                + "way(around:250,51.5,-0.12)(if:t[\"lanes\"]>2);"
                + ");out tags geom qt;", query);
    }

    @Test
    public void testCoordinatesAreRounded() {
        String query = builder.build(new Circle(1.234567891, 0, 1609.344), Lists.mutable.with("[a]"));
        assertEquals("[out:json];(way(around:1609.344,1.23457,0)[a];);out tags geom qt;", query);
    }

    @Test
    public void testNoCriteria() {
        assertEquals("[out:json];();out tags geom qt;", builder.build(new Circle(0, 0, 100), Lists.mutable.empty()));
    }
}
