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
package scilla.parser.frontend;

import java.util.ArrayList;
import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.RecognitionException;
import org.apache.log4j.Logger;

import scilla.parser.ast.ScillaAST;
import scilla.parser.ast.ScillaTreeAdaptor;
import scilla.parser.ast.antlr.ScillaLexer;
import scilla.parser.ast.antlr.ScillaParser;
import scilla.parser.common.Logging;
import scilla.parser.common.exceptions.InvalidSyntaxException;
import scilla.parser.common.exceptions.ScillaRuntimeError;

/**
 * A contract source text run through the ANTLR lexer and parser
 */
public class ParsedContract {

  private static final Logger logger = Logging.getScillaLogger();

  public final String source;
  public final ScillaAST ast;

  private ParsedContract(String source, ScillaAST ast) {
    this.source = source;
    this.ast = ast;
  }

  /**
   * Parse contract source text
   * @param source
   * @return
   * @throws InvalidSyntaxException if the lexer or parser reported any
   *            error, even one it recovered from
   */
  public static ParsedContract parse(String source)
                                      throws InvalidSyntaxException {
    ScillaAST tree = runANTLR(new ANTLRStringStream(source));
    if (logger.isTraceEnabled()) {
      logger.trace("ANTLR tree:\n" + tree.printTree());
    }
    return new ParsedContract(source, tree);
  }

  /**
     Use ANTLR to parse the input and get the Tree
   */
  private static ScillaAST runANTLR(ANTLRStringStream input)
                                      throws InvalidSyntaxException {
    ScillaLexer lexer = new ScillaLexer(input);
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    ScillaParser parser = new ScillaParser(tokens);
    parser.setTreeAdaptor(new ScillaTreeAdaptor());

    ScillaParser.program_return program;
    try {
      program = parser.program();
    } catch (RecognitionException e) {
      throw new InvalidSyntaxException(e.getClass().getSimpleName()
                                 + " at line " + e.line + ":" + e.charPositionInLine);
    }

    /* The ANTLR parser recovers from some errors and still produces
     * a tree.  Any reported diagnostic rejects the input. */
    List<String> errors = new ArrayList<String>();
    errors.addAll(lexer.syntaxErrors);
    errors.addAll(parser.syntaxErrors);
    if (!errors.isEmpty()) {
      for (String error: errors) {
        logger.debug("syntax error: " + error);
      }
      throw new InvalidSyntaxException(errors);
    }

    if (program == null || program.getTree() == null)
      throw new ScillaRuntimeError("PARSER FAILED!");

    return (ScillaAST) program.getTree();
  }
}
