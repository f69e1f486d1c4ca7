package com.wayq;

import ch.qos.logback.classic.Level;
import com.wayq.expr.ExprParseException;
import com.wayq.geo.Circle;
import com.wayq.output.OutputFormatter;
import com.wayq.query.CompiledQuery;
import com.wayq.query.FilterCompiler;
import com.wayq.query.QueryCompileException;
import com.wayq.query.RoadFilters;
import com.wayq.rewrite.DnfConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "wayq", mixinStandardHelpOptions = true, version = "1.0",
         description = "Compile a road filter expression into an Overpass query")
public class WayQ implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(WayQ.class);

    enum Format { TEXT, JSON }

    @Parameters(index = "0", arity = "0..1", description = "The filter expression (default: all roads in use)")
    private String filter = RoadFilters.DEFAULT;

    @Option(names = {"-r", "--region"}, required = true, converter = CircleConverter.class,
            description = "Target region of interest, eg -37.8,144.9,10km")
    private Circle region;

    @Option(names = {"--criteria"}, description = "Print only the criteria, one per line")
    private boolean criteriaOnly = false;

    @Option(names = {"-f", "--format"}, defaultValue = "TEXT",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Format format = Format.TEXT;

    @Option(names = {"--compact"}, description = "Compact JSON output without whitespace")
    private boolean compact = false;

    @Option(names = {"--max-dnf-rounds"}, description = "Limit on DNF rewrite rounds (default: ${DEFAULT-VALUE})")
    private int maxDnfRounds = DnfConverter.DEFAULT_MAX_ROUNDS;

    @Option(names = {"-v", "--verbose"}, description = "Log each compilation stage")
    private boolean verbose = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new WayQ())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.wayq")).setLevel(Level.DEBUG);
        }
        try {
            FilterCompiler compiler = new FilterCompiler(maxDnfRounds);
            CompiledQuery compiled = compiler.compile(region, filter);

            OutputFormatter formatter = new OutputFormatter(!compact);
            if (format == Format.JSON) {
                System.out.println(formatter.formatJson(compiled));
            } else {
                System.out.println(formatter.formatText(compiled, criteriaOnly));
            }
            return 0;
        } catch (ExprParseException | QueryCompileException e) {
            LOGGER.debug("Compilation of '{}' failed", filter, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static class CircleConverter implements CommandLine.ITypeConverter<Circle> {
        @Override
        public Circle convert(String value) {
            try {
                return Circle.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
