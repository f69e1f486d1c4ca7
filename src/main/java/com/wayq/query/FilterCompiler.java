package com.wayq.query;

import com.wayq.expr.ExprNode;
import com.wayq.expr.ExprParser;
import com.wayq.expr.ExprPrinter;
import com.wayq.geo.Circle;
import com.wayq.rewrite.DnfConverter;
import com.wayq.rewrite.MembershipExpander;
import com.wayq.rewrite.NegationNormalizer;
import org.eclipse.collections.api.list.MutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles filter expressions into Overpass queries.
 *
 * <p>Pipeline: parse, expand membership tests, push down negations, convert to DNF, generate criteria,
 * assemble the query. Instances keep no state between calls.
 */
public class FilterCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(FilterCompiler.class);

    private final MembershipExpander membershipExpander = new MembershipExpander();
    private final NegationNormalizer negationNormalizer = new NegationNormalizer();
    private final DnfConverter dnfConverter;
    private final CriteriaGenerator criteriaGenerator = new CriteriaGenerator();
    private final OverpassQueryBuilder queryBuilder = new OverpassQueryBuilder();

    public FilterCompiler() {
        this(DnfConverter.DEFAULT_MAX_ROUNDS);
    }

    public FilterCompiler(int maxDnfRounds) {
        this.dnfConverter = new DnfConverter(maxDnfRounds);
    }

    public CompiledQuery compile(Circle region, String filter) {
        MutableList<String> criteria = criteria(filter);
        String query = queryBuilder.build(region, criteria);
        LOGGER.debug("Query for {}: {}", region, query);
        return new CompiledQuery(filter, region, criteria.toImmutable(), query);
    }

    public MutableList<String> criteria(String filter) {
        ExprNode tree = new ExprParser().parse(filter);
        LOGGER.debug("Parsed: {}", ExprPrinter.print(tree));

        ExprNode rewritten = rewrite(tree);
        MutableList<String> criteria = criteriaGenerator.generate(rewritten);
        LOGGER.debug("Generated {} criteria: {}", criteria.size(), criteria);
        return criteria;
    }

    /**
     * Applies the rewrite passes: membership expansion, negation normalization and DNF conversion.
     */
    public ExprNode rewrite(ExprNode tree) {
        ExprNode expanded = membershipExpander.expand(tree);
        LOGGER.debug("Expanded: {}", ExprPrinter.print(expanded));

        ExprNode normalized = negationNormalizer.normalize(expanded);
        LOGGER.debug("Normalized: {}", ExprPrinter.print(normalized));

        DnfConverter.Conversion conversion = dnfConverter.convert(normalized);
        LOGGER.debug("DNF after {} rewrite rounds: {}", conversion.rewrites(), ExprPrinter.print(conversion.node()));
        return conversion.node();
    }
}
