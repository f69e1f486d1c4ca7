package com.wayq.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.wayq.query.CompiledQuery;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

public class OutputFormatter {
    private final JsonFactory factory = new JsonFactory();
    private final boolean prettyPrint;

    public OutputFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String formatText(CompiledQuery compiled, boolean criteriaOnly) {
        return criteriaOnly ? compiled.criteria().makeString("\n") : compiled.query();
    }

    public String formatJson(CompiledQuery compiled) {
        StringWriter writer = new StringWriter();
        try (JsonGenerator gen = factory.createGenerator(writer)) {
            if (prettyPrint) {
                gen.useDefaultPrettyPrinter();
            }
            gen.writeStartObject();

            gen.writeObjectFieldStart("region");
            gen.writeNumberField("lat", compiled.region().lat());
            gen.writeNumberField("lon", compiled.region().lon());
            gen.writeNumberField("radius", compiled.region().radius());
            gen.writeEndObject();

            gen.writeStringField("filter", compiled.filter());

            gen.writeArrayFieldStart("criteria");
            for (String criterion : compiled.criteria()) {
                gen.writeString(criterion);
            }
            gen.writeEndArray();

            gen.writeStringField("query", compiled.query());
            gen.writeEndObject();
        } catch (IOException e) {
            // StringWriter does not fail
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }
}
