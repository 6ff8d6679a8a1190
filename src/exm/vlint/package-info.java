/**
 * Static lint checks for a synthesizable Verilog subset.
 * {@link exm.vlint.VLinter} ties the parser and the lint passes together.
 */
package exm.vlint;
