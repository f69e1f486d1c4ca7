package com.wayq.output;

import com.wayq.geo.Circle;
import com.wayq.query.CompiledQuery;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OutputFormatterTest {
    private static final String QUERY = "[out:json];(way(around:10000,-37.8,144.9)[highway];"
            + "way(around:10000,-37.8,144.9)(if:t[\"lanes\"]>2);"
            + ");out tags geom qt;";

    private final CompiledQuery compiled = new CompiledQuery("is_tag(highway) or lanes > 2",
            new Circle(-37.8, 144.9, 10000), Lists.immutable.with("[highway]", "(if:t[\"lanes\"]>2)"), QUERY);

    @Test
    public void testTextQuery() {
        assertEquals(QUERY, new OutputFormatter(true).formatText(compiled, false));
    }

    @Test
    public void testTextCriteria() {
        assertEquals("[highway]\n(if:t[\"lanes\"]>2)", new OutputFormatter(true).formatText(compiled, true));
    }

    @Test
    public void testCompactJson() {
        String json = new OutputFormatter(false).formatJson(compiled);
        assertEquals("{\"region\":{\"lat\":-37.8,\"lon\":144.9,\"radius\":10000.0},"
                + "\"filter\":\"is_tag(highway) or lanes > 2\","
                + "\"criteria\":[\"[highway]\",\"(if:t[\\\"lanes\\\"]>2)\"],"
                + "\"query\":\"" + QUERY.replace("\"", "\\\"") + "\"}", json);
    }

    @Test
    public void testPrettyJson() {
        String json = new OutputFormatter(true).formatJson(compiled);
        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"filter\" : \"is_tag(highway) or lanes > 2\""));
        assertTrue(json.contains("\"radius\" : 10000.0"));
    }
}
