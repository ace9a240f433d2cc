package com.viffx.Fsm.Compiler;

import com.viffx.Fsm.Grammar.Grammar;
import com.viffx.Fsm.Symbols.SymbolType;
import com.viffx.Fsm.Symbols.Terminal;
import org.junit.Test;

import static org.junit.Assert.*;

public class ParseTableTest {
    private static final Position AT = Position.START;

    @Test
    public void testUnknownActionsAreRejected() throws Exception {
        Grammar grammar = Grammar.parse("START > e @accept; e > ID() @nope | NUM() @neither;");
        try {
            ParseTable.build(grammar);
            fail("grammar with unknown actions accepted");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("[neither, nope]"));
        }
    }

    @Test
    public void testSymbolIndex() {
        ParseTable table = ParseTable.standard();
        Grammar grammar = table.grammar();

        assertEquals(grammar.indexOf(new Terminal(SymbolType.KEY, "def")),
                table.symbolIndex(0, new Token(SymbolType.KEY, "def", AT)));
        assertEquals(grammar.EOF(), table.symbolIndex(0, Token.eof(AT)));
        assertEquals("identifiers map to the wildcard terminal",
                grammar.indexOf(new Terminal(SymbolType.ID, null)),
                table.symbolIndex(0, new Token(SymbolType.ID, "bits", AT)));
        assertEquals(-1, table.symbolIndex(0, new Token(SymbolType.COMMENT, "note", AT)));
    }

    @Test
    public void testRowsDoNotChange() {
        ParseTable table = ParseTable.standard();
        int def = table.grammar().indexOf(new Terminal(SymbolType.KEY, "def"));
        Action shift = table.action(0, def);
        assertEquals(ActionType.SHIFT, shift.type());
        assertNull(table.action(0, table.grammar().EOF()));
        assertSame(table.grammar(), new Parser().options().table().grammar());
    }
}
