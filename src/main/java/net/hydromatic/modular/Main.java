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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.modular.arith.Cusp;
import net.hydromatic.modular.arith.Matrix;
import net.hydromatic.modular.eval.Prop;
import net.hydromatic.modular.eval.Session;
import net.hydromatic.modular.group.CongruenceSubgroups;
import net.hydromatic.modular.group.ModularSubgroup;
import net.hydromatic.modular.group.ModularSubgroups;
import net.hydromatic.modular.perm.Perm;
import net.hydromatic.modular.util.InvalidInputException;
import net.hydromatic.modular.util.ModularException;
import net.hydromatic.modular.word.StDecomposition;

/** Command interpreter for modular subgroups.
 *
 * <p>Reads one command per line, and writes the result of each. Text from
 * "#" to the end of a line is a comment. */
public class Main {
  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  final Interpreter interpreter;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Main main =
        new Main(argList, System.in, System.out, new LinkedHashMap<>());
    try {
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(List<String> argList, InputStream in, PrintStream out,
      Map<Prop, Object> propMap) {
    this(argList, new InputStreamReader(in), new OutputStreamWriter(out),
        propMap);
  }

  /** Creates a Main. */
  public Main(List<String> argList, Reader in, Writer out,
      Map<Prop, Object> propMap) {
    this.in = new BufferedReader(in);
    this.out = new PrintWriter(out);
    this.echo = argList.contains("--echo");
    this.interpreter = new Interpreter(Session.DEFAULT.withProps(propMap));
  }

  /** Reads and executes commands until the end of input. */
  public void run() {
    try {
      for (;;) {
        final String line = in.readLine();
        if (line == null) {
          break;
        }
        if (echo) {
          out.println("> " + line);
        }
        interpreter.execute(line, out::println);
        out.flush();
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } finally {
      out.flush();
    }
  }

  /** Executes commands against a session and a set of named subgroups.
   *
   * <p>Subgroups are created in the session that is current when the
   * command that creates them runs; a later {@code set} command does not
   * affect them. */
  public static class Interpreter {
    private static final Splitter WORDS =
        Splitter.on(' ').trimResults().omitEmptyStrings();
    private static final String SUBGROUP_USAGE =
        "subgroup NAME s=PERM t=PERM | subgroup NAME gens=MATRIX;MATRIX...";

    private Session session;
    private final Map<String, ModularSubgroup> subgroups =
        new LinkedHashMap<>();

    public Interpreter(Session session) {
      this.session = session;
    }

    /** Returns the current session. */
    public Session session() {
      return session;
    }

    /** Executes one line, writing output lines to a consumer. Errors are
     * written as output; they do not propagate. */
    public void execute(String line, Consumer<String> outLines) {
      final int hash = line.indexOf('#');
      final String command = hash >= 0 ? line.substring(0, hash) : line;
      final List<String> words =
          WORDS.splitToList(command.replace('\t', ' '));
      if (words.isEmpty()) {
        return;
      }
      try {
        execute(words, outLines);
      } catch (RuntimeException e) {
        if (!(e instanceof ModularException)) {
          throw e;
        }
        outLines.accept(((ModularException) e)
            .describeTo(new StringBuilder()).toString());
      }
    }

    private void execute(List<String> words, Consumer<String> outLines) {
      final String verb = words.get(0);
      final List<String> args = words.subList(1, words.size());
      switch (verb) {
        case "help":
          help(outLines);
          return;
        case "subgroup":
          if (args.isEmpty()) {
            throw usage(SUBGROUP_USAGE);
          }
          define(args.get(0), subgroup(args.subList(1, args.size())),
              outLines);
          return;
        case "gamma":
        case "gamma0":
        case "gamma1":
          checkArgCount(args, 2, verb + " NAME N");
          define(args.get(0), congruenceSubgroup(verb, args.get(1)),
              outLines);
          return;
        case "index":
          checkArgCount(args, 1, "index NAME");
          outLines.accept(Integer.toString(lookup(args.get(0)).index()));
          return;
        case "cusps":
          checkArgCount(args, 1, "cusps NAME");
          outLines.accept(lookup(args.get(0)).cusps().toString());
          return;
        case "cusps-redundant":
          checkArgCount(args, 1, "cusps-redundant NAME");
          outLines.accept(lookup(args.get(0)).cuspsRedundant().toString());
          return;
        case "width":
          checkArgCount(args, 2, "width NAME CUSP");
          outLines.accept(
              Integer.toString(
                  lookup(args.get(0)).cuspWidth(Cusp.parse(args.get(1)))));
          return;
        case "equivalent":
          checkArgCount(args, 3, "equivalent NAME CUSP CUSP");
          outLines.accept(
              Boolean.toString(
                  lookup(args.get(0))
                      .cuspsEquivalent(Cusp.parse(args.get(1)),
                          Cusp.parse(args.get(2)))));
          return;
        case "level":
          checkArgCount(args, 1, "level NAME");
          outLines.accept(lookup(args.get(0)).generalizedLevel().toString());
          return;
        case "congruence":
          checkArgCount(args, 1, "congruence NAME");
          outLines.accept(Boolean.toString(lookup(args.get(0)).isCongruence()));
          return;
        case "genus":
          checkArgCount(args, 1, "genus NAME");
          outLines.accept(Integer.toString(lookup(args.get(0)).genus()));
          return;
        case "element":
          checkArgCount(args, 2, "element NAME MATRIX");
          outLines.accept(
              Boolean.toString(
                  lookup(args.get(0)).contains(Matrix.parse(args.get(1)))));
          return;
        case "generators":
          checkArgCount(args, 1, "generators NAME");
          lookup(args.get(0)).generators()
              .forEach(m -> outLines.accept(m.toString()));
          return;
        case "conjugate":
          checkArgCount(args, 4, "conjugate NAME MATRIX as NAME");
          if (!args.get(2).equals("as")) {
            throw usage("conjugate NAME MATRIX as NAME");
          }
          define(args.get(3),
              lookup(args.get(0)).conjugate(Matrix.parse(args.get(1))),
              outLines);
          return;
        case "decompose":
          checkArgCount(args, 1, "decompose MATRIX");
          outLines.accept(
              StDecomposition.decompose(Matrix.parse(args.get(0)))
                  .toString());
          return;
        case "set":
          checkArgCount(args, 2, "set PROPERTY VALUE");
          final Prop prop = Prop.lookup(args.get(0));
          session = session.withProp(prop, args.get(1));
          outLines.accept(prop.camelName + " = " + prop.get(session.map));
          return;
        default:
          throw new InvalidInputException("unknown command '" + verb
              + "'; type 'help' for a list of commands");
      }
    }

    private void define(String name, ModularSubgroup g,
        Consumer<String> outLines) {
      subgroups.put(name, g);
      outLines.accept(name + ": index " + g.index());
    }

    private ModularSubgroup lookup(String name) {
      final ModularSubgroup g = subgroups.get(name);
      if (g == null) {
        throw new InvalidInputException("unknown subgroup '" + name + "'");
      }
      return g;
    }

    private ModularSubgroup subgroup(List<String> args) {
      if (args.size() == 1 && args.get(0).startsWith("gens=")) {
        final ImmutableList.Builder<Matrix> generators =
            ImmutableList.builder();
        for (String s
            : Splitter.on(';').omitEmptyStrings()
                .split(args.get(0).substring("gens=".length()))) {
          generators.add(Matrix.parse(s));
        }
        return ModularSubgroups.fromGenerators(session, generators.build());
      }
      if (args.size() == 2
          && args.get(0).startsWith("s=")
          && args.get(1).startsWith("t=")) {
        final Perm s = Perm.parse(args.get(0).substring("s=".length()));
        final Perm t = Perm.parse(args.get(1).substring("t=".length()));
        return ModularSubgroups.fromPermutations(session, s, t);
      }
      throw usage(SUBGROUP_USAGE);
    }

    private ModularSubgroup congruenceSubgroup(String verb, String level) {
      final int n;
      try {
        n = new BigInteger(level).intValueExact();
      } catch (NumberFormatException | ArithmeticException e) {
        throw new InvalidInputException("invalid level '" + level + "'", e);
      }
      switch (verb) {
        case "gamma":
          return CongruenceSubgroups.gamma(session, n);
        case "gamma0":
          return CongruenceSubgroups.gamma0(session, n);
        case "gamma1":
          return CongruenceSubgroups.gamma1(session, n);
        default:
          throw new AssertionError(verb);
      }
    }

    private static void checkArgCount(List<String> args, int count,
        String usage) {
      if (args.size() != count) {
        throw usage(usage);
      }
    }

    private static InvalidInputException usage(String usage) {
      return new InvalidInputException("usage: " + usage);
    }

    static void help(Consumer<String> outLines) {
      String[] helpLines = {
          "Commands:",
          "    subgroup NAME s=PERM t=PERM   Define a subgroup by its coset"
              + " action",
          "    subgroup NAME gens=M;M...     Define a subgroup by generators",
          "    gamma NAME N                  Define Gamma(N)",
          "    gamma0 NAME N                 Define Gamma0(N)",
          "    gamma1 NAME N                 Define Gamma1(N)",
          "    conjugate NAME M as NAME2     Define the conjugate M^-1 G M",
          "    index NAME                    Print the index",
          "    cusps NAME                    Print inequivalent cusps",
          "    cusps-redundant NAME          Print one cusp per coset",
          "    width NAME CUSP               Print the width of a cusp",
          "    equivalent NAME CUSP CUSP     Print whether cusps are"
              + " equivalent",
          "    level NAME                    Print the generalized level",
          "    congruence NAME               Print whether a congruence"
              + " subgroup",
          "    genus NAME                    Print the genus",
          "    element NAME M                Print whether M is an element",
          "    generators NAME               Print generators",
          "    decompose M                   Print M as a word in S and T",
          "    set PROPERTY VALUE            Set a property",
          "    help                          Print this help",
          "PERM is in cycle notation, e.g. (1,2)(3,4); M is a matrix"
              + " [[a,b],[c,d]];",
          "CUSP is infinity, an integer, or p/q. Arguments contain no"
              + " spaces.",
      };
      Arrays.asList(helpLines).forEach(outLines);
    }
  }
}

// End Main.java
