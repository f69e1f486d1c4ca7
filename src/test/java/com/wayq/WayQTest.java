package com.wayq;

import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class WayQTest {
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    public void redirect() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    public void restore() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        ((Logger) LoggerFactory.getLogger("com.wayq")).setLevel(null);
    }

    private int run(String... args) {
        return new CommandLine(new WayQ())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).strip();
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8).strip();
    }

    @Test
    public void testQuery() {
        assertEquals(0, run("--region=-37.8,144.9,10km", "highway == 'primary'"));
        assertEquals("[out:json];(way(around:10000,-37.8,144.9)[highway=\"primary\"];);out tags geom qt;", stdout());
    }

    @Test
    public void testCriteriaOnly() {
        assertEquals(0, run("--region=-37.8,144.9", "--criteria",
                "(highway == 'primary' or highway == 'secondary') and surface == 'asphalt'"));
        assertEquals("[highway=\"primary\"][surface=\"asphalt\"]\n[highway=\"secondary\"][surface=\"asphalt\"]",
                stdout().replace("\r\n", "\n"));
    }

    @Test
    public void testDefaultFilter() {
        assertEquals(0, run("-r", "0,0", "--criteria"));
        assertTrue(stdout().startsWith("[highway][highway!=\"proposed\"]"));
        assertTrue(stdout().endsWith("[area!=\"yes\"]"));
    }

    @Test
    public void testJson() {
        assertEquals(0, run("--region=-37.8,144.9,10km", "--format", "json", "--compact", "is_tag(highway)"));
        assertEquals("{\"region\":{\"lat\":-37.8,\"lon\":144.9,\"radius\":10000.0},"
                + "\"filter\":\"is_tag(highway)\",\"criteria\":[\"[highway]\"],"
                + "\"query\":\"[out:json];(way(around:10000,-37.8,144.9)[highway];);out tags geom qt;\"}", stdout());
    }

    @Test
    public void testCompileErrors() {
        assertEquals(1, run("--region=0,0", "highway =="));
        assertEquals("Error: unexpected end of input at position 10", stderr());
        assertEquals("", stdout());
    }

    @Test
    public void testUnsupportedFilter() {
        assertEquals(1, run("--region=0,0", "tags.highway == 'x'"));
        assertEquals("Error: member not supported", stderr());
    }

    @Test
    public void testUsageErrors() {
        assertEquals(2, run("highway == 'primary'"));
        assertEquals(2, run("--region=91,0", "highway == 'primary'"));
        assertTrue(stderr().contains("latitude \"91\" not within range"));
        assertEquals(2, run("--region=0,0", "--format", "xml"));
        assertEquals(2, run("--region=0,0,1e999", "oneway"));
        assertTrue(stderr().contains("radius number \"1e999\" out of range"));
    }

    @Test
    public void testVerbose() {
        assertEquals(0, run("--region=0,0", "-v", "oneway"));
        assertTrue(((Logger) LoggerFactory.getLogger("com.wayq")).isDebugEnabled());
        assertEquals("[out:json];(way(around:100,0,0)[oneway=\"yes\"];);out tags geom qt;", stdout());
    }
}
