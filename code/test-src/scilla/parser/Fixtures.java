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
package scilla.parser;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;

import org.apache.commons.io.IOUtils;

/**
 * Access to the contracts under test-resources/contracts
 */
public class Fixtures {

  private static final String DIR = "/contracts/";

  public static String read(String name) throws IOException {
    InputStream in = Fixtures.class.getResourceAsStream(DIR + name);
    if (in == null) {
      throw new IOException("No fixture " + name);
    }
    try {
      return IOUtils.toString(in, "UTF-8");
    } finally {
      in.close();
    }
  }

  public static File file(String name) throws IOException {
    URL url = Fixtures.class.getResource(DIR + name);
    if (url == null) {
      throw new IOException("No fixture " + name);
    }
    try {
      return new File(url.toURI());
    } catch (URISyntaxException e) {
      throw new IOException(e);
    }
  }
}
