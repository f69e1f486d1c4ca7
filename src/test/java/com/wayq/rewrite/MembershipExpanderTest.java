package com.wayq.rewrite;

import com.wayq.expr.ExprNode;
import com.wayq.expr.ExprParser;
import com.wayq.expr.ExprPrinter;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class MembershipExpanderTest {
    private final MembershipExpander expander = new MembershipExpander();

    private String expand(String expression) {
        return ExprPrinter.print(expander.expand(new ExprParser().parse(expression)));
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', quoteCharacter = '"', value = {
            "highway in ['primary']                  ; highway == 'primary'",
            "highway in ['primary', 'secondary', 'tertiary'] ; ((highway == 'primary') or (highway == 'secondary')) or (highway == 'tertiary')",
            "access not in ['private', 'no']         ; not ((access == 'private') or (access == 'no'))",
            "sport in []                             ; false",
            "sport not in []                         ; not false",
            "lanes in 2..4                           ; (lanes >= 2) and (lanes <= 4)",
            "lanes not in 2..4                       ; not ((lanes >= 2) and (lanes <= 4))",
            "lanes in 2..2                           ; lanes == 2",
            "lanes not in 3..3                       ; not (lanes == 3)",
            "name in 'a'..'a'                        ; name == 'a'",
            "lanes in 1..1.0                         ; (lanes >= 1) and (lanes <= 1)",
            "lanes in a..a                           ; (lanes >= a) and (lanes <= a)",
            "highway in tags                         ; highway in tags",
            "f(x in [1]) and y not in [2]            ; f(x == 1) and (not (y == 2))",
    })
    public void testExpansion(String input, String expected) {
        assertEquals(expected, expand(input));
    }

    @Test
    public void testUnrelatedTreeIsReturnedAsIs() {
        ExprNode tree = new ExprParser().parse("a == 1 and not b");
        assertSame(tree, expander.expand(tree));

        ExprNode call = new ExprParser().parse("f(a, [1, 2]) == g()");
        assertSame(call, expander.expand(call));
    }

    @Test
    public void testArrayMembershipIsEquivalentToDisjunction() {
        ExprNode in = new ExprParser().parse("x in ['a', 'b', 'c']");
        ExprNode notIn = new ExprParser().parse("x not in ['a', 'b', 'c']");
        ExprNode expandedIn = expander.expand(in);
        ExprNode expandedNotIn = expander.expand(notIn);

        for (String x : new String[]{"a", "b", "c", "d", ""}) {
            MutableMap<String, Object> env = Maps.mutable.with("x", x);
            assertEquals(TruthTable.eval(in, env), TruthTable.eval(expandedIn, env), "x=" + x);
            assertEquals(TruthTable.eval(notIn, env), TruthTable.eval(expandedNotIn, env), "x=" + x);
        }
    }

    @Test
    public void testRangeMembershipIsEquivalentToBounds() {
        ExprNode in = new ExprParser().parse("x in 3..6");
        ExprNode notIn = new ExprParser().parse("x not in 3..6");
        ExprNode single = new ExprParser().parse("x in 4..4");
        ExprNode expandedIn = expander.expand(in);
        ExprNode expandedNotIn = expander.expand(notIn);
        ExprNode expandedSingle = expander.expand(single);

        for (long x = 0; x <= 8; x++) {
            MutableMap<String, Object> env = Maps.mutable.with("x", x);
            assertEquals(TruthTable.eval(in, env), TruthTable.eval(expandedIn, env), "x=" + x);
            assertEquals(TruthTable.eval(notIn, env), TruthTable.eval(expandedNotIn, env), "x=" + x);
            assertEquals(TruthTable.eval(single, env), TruthTable.eval(expandedSingle, env), "x=" + x);
        }
    }
}
