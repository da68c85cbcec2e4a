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
package scilla.parser.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import scilla.parser.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    System.clearProperty(Settings.PRINT_TYPES);
    Settings.reset();
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    Settings.initProperties();
    assertEquals("", Settings.get(Settings.LOG_FILE));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertTrue(Settings.getBoolean(Settings.PRINT_TYPES));
  }

  @Test
  public void testSystemPropertyOverride() throws InvalidOptionException {
    System.setProperty(Settings.PRINT_TYPES, "false");
    Settings.initProperties();
    assertFalse(Settings.getBoolean(Settings.PRINT_TYPES));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    System.setProperty(Settings.PRINT_TYPES, "yes");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.PRINT_TYPES);
    Settings.initProperties();
  }

  @Test
  public void testUnknownSetting() throws InvalidOptionException {
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean("scilla.no.such.setting");
  }
}
