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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import org.junit.After;
import org.junit.Test;

import scilla.parser.Fixtures;
import scilla.parser.common.Logging;
import scilla.parser.common.Settings;
import scilla.parser.common.exceptions.ScillaFatal;
import scilla.parser.common.lang.Contract;

public class MainTest {

  @After
  public void resetSettings() {
    Settings.reset();
  }

  private static String render(Contract contract, boolean types) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes);
    Main.print(contract, types, out);
    out.flush();
    return bytes.toString();
  }

  @Test
  public void testArgs() {
    String input = Main.processArgs(new String[] {"-v", "-l", "parse.log",
                                                  "HelloWorld.scilla"});
    assertEquals("HelloWorld.scilla", input);
    assertEquals("true", Settings.get(Settings.LOG_TRACE));
    assertEquals("parse.log", Settings.get(Settings.LOG_FILE));
    assertEquals("HelloWorld.scilla", Settings.get(Settings.INPUT_FILENAME));
  }

  @Test
  public void testMissingInput() {
    try {
      Main.processArgs(new String[] {"-v"});
      fail("Expected ScillaFatal");
    } catch (ScillaFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
    }
  }

  @Test
  public void testUnknownOption() {
    try {
      Main.processArgs(new String[] {"--frobnicate", "a.scilla"});
      fail("Expected ScillaFatal");
    } catch (ScillaFatal e) {
      assertEquals(ExitCode.ERROR_COMMAND.code(), e.exitCode);
    }
  }

  @Test
  public void testPrint() throws Exception {
    Contract c = ContractParser.parseContract(
                        Fixtures.read("HelloWorld.scilla"));
    String text = render(c, true);
    assertTrue(text, text.startsWith("contract HelloWorld"));
    assertTrue(text, text.contains("  owner : ByStr20"));
    assertTrue(text, text.contains("  welcome_msg : String"));
    assertTrue(text, text.contains("  setHello"));
    assertTrue(text, text.contains("    msg : String"));

    String names = render(c, false);
    assertTrue(names, names.contains("  owner"));
    assertTrue(names, !names.contains("ByStr20"));
  }

  @Test
  public void testRunExitCodes() throws Exception {
    PrintStream out = new PrintStream(new ByteArrayOutputStream());
    Main.run(Logging.getScillaLogger(),
             Fixtures.file("chainid.scilla").getPath(), out);

    try {
      Main.run(Logging.getScillaLogger(), "no/such/file.scilla", out);
      fail("Expected ScillaFatal");
    } catch (ScillaFatal e) {
      assertEquals(ExitCode.ERROR_IO.code(), e.exitCode);
    }
  }
}
