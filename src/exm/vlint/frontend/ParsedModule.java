/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.vlint.frontend;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTreeAdaptor;

import exm.vlint.ast.VlogAST;
import exm.vlint.ast.antlr.VLintLexer;
import exm.vlint.ast.antlr.VLintParser;
import exm.vlint.common.exceptions.InvalidSyntaxException;
import exm.vlint.common.exceptions.VLintRuntimeError;
import exm.vlint.frontend.tree.Module;

/**
 * Represents a parsed Verilog source text
 */
public class ParsedModule {

  public ParsedModule(String sourceName, VlogAST ast) {
    this.sourceName = sourceName;
    this.ast = ast;
  }

  /** Name used in error messages, e.g. a file name */
  public final String sourceName;
  public final VlogAST ast;

  /**
   * Parse the source text and create a ParsedModule object
   * @param sourceName name used to report errors
   * @param text Verilog source holding one module
   * @return
   * @throws InvalidSyntaxException if the lexer or parser rejected the text
   */
  public static ParsedModule parse(String sourceName, String text)
      throws InvalidSyntaxException {
    VlogAST tree = runANTLR(sourceName, new ANTLRStringStream(text));
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(0, "AST for " + sourceName + ":\n" + tree.printTree());
    }
    return new ParsedModule(sourceName, tree);
  }

  /**
   * Build the typed module model from the tree
   */
  public Module buildModule() {
    return Module.fromAST(ast);
  }

  /**
     Use ANTLR to parse the input and get the Tree
   */
  private static VlogAST runANTLR(String sourceName, ANTLRStringStream input)
      throws InvalidSyntaxException {
    VLintLexer lexer = new VLintLexer(input);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    VLintParser parser = new VLintParser(tokens);
    parser.setTreeAdaptor(new VlogTreeAdaptor());

    VLintParser.module_def_return module = null;
    try {
      module = parser.module_def();
    } catch (RecognitionException e) {
      // A bad character usually shows up as a parse error later on,
      // so report the lexer's complaint first
      checkLexerErrors(sourceName, lexer);
      String msg = parser.getErrorMessage(e, parser.getTokenNames());
      LogHelper.debug(0, "Parsing " + sourceName + " failed: " + msg);
      throw new InvalidSyntaxException(sourceName, e.line,
                                       e.charPositionInLine, msg);
    }
    checkLexerErrors(sourceName, lexer);

    if (module == null || module.getTree() == null)
      throw new VLintRuntimeError("PARSER FAILED!");

    return (VlogAST) module.getTree();
  }

  private static void checkLexerErrors(String sourceName, VLintLexer lexer)
      throws InvalidSyntaxException {
    if (!lexer.errors.isEmpty()) {
      String msg = lexer.errors.get(0);
      LogHelper.debug(0, "Lexing " + sourceName + " failed: " + msg);
      throw new InvalidSyntaxException(sourceName + ": " + msg);
    }
  }

  public static class VlogTreeAdaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new VlogAST(t);
    }
  }
}
