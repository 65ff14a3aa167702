package com.contextsmith.ahocorasick.utils;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Simple command line parser.
 *
 * <pre>
 *   Args.match()
 *       .on(options("--text", "-t"), value -> textPath = value)
 *       .on("--verbose", () -> verbose = true)
 *       .rest(rest -> positional = rest)
 *       .parse(args);
 * </pre>
 *
 * Options taking a value consume the argument that follows them; the value
 * is null when the option is the last argument.
 */
public class Args {

  public static Args match() {
    return new Args();
  }

  public static Predicate<String> options(String... alternatives) {
    if (alternatives.length == 1) {
      return s -> alternatives[0].equalsIgnoreCase(s);
    }
    return s -> Arrays.stream(alternatives).anyMatch(alt -> alt.equalsIgnoreCase(s));
  }

  private final List<Option> options;
  private Consumer<List<String>> restHandler;

  public Args() {
    this.options = new ArrayList<>();
  }

  public Args on(String option, Runnable handler) {
    return on(options(option), handler);
  }

  public Args on(String option, Consumer<String> handler) {
    return on(options(option), handler);
  }

  public Args on(Predicate<String> test, Runnable handler) {
    checkNotNull(handler);
    this.options.add(new Option(test, false, value -> handler.run()));
    return this;
  }

  public Args on(Predicate<String> test, Consumer<String> handler) {
    this.options.add(new Option(test, true, handler));
    return this;
  }

  /** Receives, in order, every argument no option consumed. */
  public Args rest(Consumer<List<String>> restHandler) {
    this.restHandler = checkNotNull(restHandler);
    return this;
  }

  public void parse(String... args) {
    List<String> rest = new ArrayList<>();
    for (int i = 0; i < args.length; ++i) {
      Option option = find(args[i]);
      if (option == null) {
        rest.add(args[i]);
      } else if (option.takesValue) {
        String value = (i + 1 < args.length) ? args[++i] : null;
        option.handler.accept(value);
      } else {
        option.handler.accept(null);
      }
    }
    if (this.restHandler != null) this.restHandler.accept(rest);
  }

  private Option find(String arg) {
    for (Option option : this.options) {
      if (option.test.test(arg)) return option;
    }
    return null;
  }

  private static class Option {
    final Predicate<String> test;
    final boolean takesValue;
    final Consumer<String> handler;

    Option(Predicate<String> test, boolean takesValue, Consumer<String> handler) {
      this.test = checkNotNull(test);
      this.takesValue = takesValue;
      this.handler = checkNotNull(handler);
    }
  }
}
