/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.modular;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.StringContains.containsString;

import com.google.common.collect.ImmutableList;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hamcrest.Matcher;
import org.junit.jupiter.api.Test;

/** Tests the Shell. */
public class ShellTest {
  final List<String> argList =
      ImmutableList.of("--system=false", "--banner=false", "--terminal=dumb");

  private static void assertShellOutput(List<String> argList,
      String inputString, Matcher<String> matcher) throws IOException {
    final ByteArrayOutputStream baos = new ByteArrayOutputStream();
    final Shell shell =
        Shell.create(argList,
            new ByteArrayInputStream(
                inputString.getBytes(StandardCharsets.UTF_8)),
            baos);
    shell.run();
    final String outString = baos.toString(StandardCharsets.UTF_8.name());
    assertThat(outString, matcher);
  }

  /** Tests {@link Shell} with empty input. */
  @Test
  void testShell() throws IOException {
    assertShellOutput(ImmutableList.of("--system=false", "--terminal=dumb"),
        "", containsString("modular version 0.1"));
  }

  @Test
  void testHelp() throws IOException {
    assertShellOutput(ImmutableList.of("--system=false", "--help"), "",
        containsString("Usage: java net.hydromatic.modular.Shell"));
  }

  @Test
  void testCommands() throws IOException {
    final String in = "gamma0 g 11\n"
        + "congruence g\n"
        + "quit\n";
    final ByteArrayOutputStream baos = new ByteArrayOutputStream();
    Shell.create(argList,
        new ByteArrayInputStream(in.getBytes(StandardCharsets.UTF_8)), baos)
        .run();
    final String out = baos.toString(StandardCharsets.UTF_8.name());
    assertThat(out, containsString("g: index 12"));
    assertThat(out, containsString("true"));
  }

  @Test
  void testParse() {
    final Shell.Config config =
        Shell.parse(Shell.Config.DEFAULT,
            ImmutableList.of("--banner=false", "--terminal=dumb"));
    assertThat(config.banner, is(false));
    assertThat(config.dumb, is(true));
    assertThat(config.system, is(true));
    assertThat(config.help, is(false));
    assertThat(Shell.parse(Shell.Config.DEFAULT, ImmutableList.of()),
        is(Shell.Config.DEFAULT));
  }
}

// End ShellTest.java
