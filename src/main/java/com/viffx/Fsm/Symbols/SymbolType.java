package com.viffx.Fsm.Symbols;

public enum SymbolType {
    KEY,   // reserved word ex: def
    ID,    // value identifier ex: state1
    TYPE,  // type identifier ex: Alphabet
    CHR,   // character literal ex: 'a'
    NUM,   // a series of digits ex: 1234
    STR,   // string literal ex: "abc"
    SYM,   // punctuation ex: ->
    CMP,   // comparison operator ex: ==
    LOGIC, // logic operator ex: &&
    COMMENT,
    EPSILON,
    EOF,   // End Of File
    TEST;  // lookahead placeholder used while generating the parse table

    /**
     * Returns whether tokens of this type can be produced by the lexer and written as
     * terminals in a grammar file.
     *
     * @return {@code true} for the lexical token types
     */
    public boolean isLexical() {
        return ordinal() <= LOGIC.ordinal();
    }
}
