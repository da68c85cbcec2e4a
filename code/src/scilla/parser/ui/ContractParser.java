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
package scilla.parser.ui;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import scilla.parser.ast.WithMetaData;
import scilla.parser.ast.nodes.NodeProgram;
import scilla.parser.common.Logging;
import scilla.parser.common.exceptions.ContractIOException;
import scilla.parser.common.exceptions.ScillaException;
import scilla.parser.common.lang.Contract;
import scilla.parser.frontend.ParsedContract;
import scilla.parser.frontend.tree.ProgramTree;
import scilla.parser.sr.SrEmitter;

/**
 * Entry point for turning Scilla source into a {@link Contract}.
 *
 * Each call builds fresh parser and emitter objects, so calls are
 * independent of each other.
 */
public class ContractParser {

  private static final Logger logger = Logging.getScillaLogger();

  /**
   * Parse and lower a contract.
   * @param source full text of a .scilla file
   * @return the deployable surface of the contract
   * @throws ScillaException if the text does not parse or cannot be lowered
   */
  public static Contract parseContract(String source)
                                          throws ScillaException {
    WithMetaData<NodeProgram> program = parseProgram(source);
    Contract contract = new SrEmitter().emit(program);
    logger.debug("Parsed contract " + contract.name());
    return contract;
  }

  /**
   * Read a contract file as UTF-8 and parse it.
   * @param path
   * @throws ContractIOException if the file cannot be read
   */
  public static Contract parseContractFile(File path)
                                          throws ScillaException {
    String source;
    try {
      source = FileUtils.readFileToString(path, "UTF-8");
    } catch (IOException e) {
      throw new ContractIOException(path.getPath(), e);
    }
    logger.debug("Read " + source.length() + " characters from " + path);
    return parseContract(source);
  }

  /**
   * Parse only, for backends other than the lowering engine.
   * @param source
   * @return the root of the typed AST
   */
  public static WithMetaData<NodeProgram> parseProgram(String source)
                                          throws ScillaException {
    logger.debug("Parsing contract source");
    ParsedContract parsed = ParsedContract.parse(source);
    WithMetaData<NodeProgram> program = ProgramTree.fromAST(parsed.ast);
    logger.debug("Built AST for scilla_version "
                 + program.node().version());
    return program;
  }
}
