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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.modular.eval.Session;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/** Interactive shell for modular subgroups, powered by JLine3. */
public class Shell {
  private final Config config;
  private final Terminal terminal;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    try {
      final Config config = parse(Config.DEFAULT, ImmutableList.copyOf(args));
      final Shell shell = create(config, System.in, System.out);
      shell.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Shell. */
  public static Shell create(List<String> args, InputStream in,
      OutputStream out) throws IOException {
    return create(parse(Config.DEFAULT, args), in, out);
  }

  /** Creates a Shell. */
  public static Shell create(Config config, InputStream in,
      OutputStream out) throws IOException {
    final TerminalBuilder builder = TerminalBuilder.builder();
    builder.streams(in, out);
    builder.system(config.system);
    builder.dumb(config.dumb);
    if (config.dumb) {
      builder.type("dumb");
    }
    return new Shell(config, builder.build());
  }

  /** Creates a Shell. */
  public Shell(Config config, Terminal terminal) {
    this.config = config;
    this.terminal = terminal;
  }

  /** Parses an argument list to an equivalent Config. */
  public static Config parse(Config config, List<String> argList) {
    Config c = config;
    for (String arg : argList) {
      if (arg.equals("--banner=false")) {
        c = c.withBanner(false);
      }
      if (arg.equals("--terminal=dumb")) {
        c = c.withDumb(true);
      }
      if (arg.equals("--system=false")) {
        c = c.withSystem(false);
      }
      if (arg.equals("--help")) {
        c = c.withHelp(true);
      }
    }
    return c;
  }

  static void usage(Consumer<String> outLines) {
    String[] usageLines = {
        "Usage: java " + Shell.class.getName()
            + " [--banner=false] [--terminal=dumb] [--help]",
        "Type 'help' at the prompt for a list of commands,"
            + " 'quit' to exit.",
    };
    Arrays.asList(usageLines).forEach(outLines);
  }

  /** Generates a banner to be shown on startup. */
  private String banner() {
    return "modular version 0.1"
        + " (java version \"" + System.getProperty("java.version")
        + "\", " + terminal.getName()
        + ", " + terminal.getType() + ")";
  }

  public void run() {
    if (config.help) {
      usage(terminal.writer()::println);
      terminal.writer().flush();
      return;
    }

    final String prompt = new AttributedStringBuilder()
        .style(AttributedStyle.DEFAULT.bold()).append("modular>")
        .style(AttributedStyle.DEFAULT).append(" ")
        .toAnsi(terminal);

    if (config.banner) {
      terminal.writer().println(banner());
    }
    final LineReader lineReader = LineReaderBuilder.builder()
        .appName("modular")
        .terminal(terminal)
        .build();

    final Main.Interpreter interpreter =
        new Main.Interpreter(Session.DEFAULT);
    for (;;) {
      final String line;
      try {
        line = lineReader.readLine(prompt);
      } catch (UserInterruptException e) {
        continue;
      } catch (EndOfFileException e) {
        break;
      }
      final String trimmed = line.trim();
      if (trimmed.equalsIgnoreCase("quit")
          || trimmed.equalsIgnoreCase("exit")) {
        break;
      }
      interpreter.execute(line, terminal.writer()::println);
      terminal.writer().flush();
    }
    terminal.writer().flush();
  }

  /** Shell configuration. */
  public static class Config {
    public static final Config DEFAULT =
        new Config(true, false, true, false);

    final boolean banner;
    final boolean dumb;
    final boolean system;
    final boolean help;

    private Config(boolean banner, boolean dumb, boolean system,
        boolean help) {
      this.banner = banner;
      this.dumb = dumb;
      this.system = system;
      this.help = help;
    }

    public Config withBanner(boolean banner) {
      if (this.banner == banner) {
        return this;
      }
      return new Config(banner, dumb, system, help);
    }

    public Config withDumb(boolean dumb) {
      if (this.dumb == dumb) {
        return this;
      }
      return new Config(banner, dumb, system, help);
    }

    public Config withSystem(boolean system) {
      if (this.system == system) {
        return this;
      }
      return new Config(banner, dumb, system, help);
    }

    public Config withHelp(boolean help) {
      if (this.help == help) {
        return this;
      }
      return new Config(banner, dumb, system, help);
    }
  }
}

// End Shell.java
