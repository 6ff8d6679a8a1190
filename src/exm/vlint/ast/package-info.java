/**
 * This package contains the parser used for generating an AST from Verilog
 * source.  The grammar lives in the antlr subpackage; the generated lexer
 * and parser are written there at build time.
 */
package exm.vlint.ast;
