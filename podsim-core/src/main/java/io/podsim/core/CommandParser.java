package io.podsim.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shell-like command line parser.
 *
 * <p>Tokens are separated by whitespace outside single or double quotes. Quotes are removed but the
 * whitespace they protect is kept, so {@code sinfo -o "%n %G"} yields the flag value {@code %n %G}.
 * A token starting with a dash is a flag; it takes the following token as its value unless that
 * token is itself a flag, and {@code --name=value} splits at the first {@code =}. A token that
 * begins with a quote is never a flag.
 *
 * <p>Parsing never fails. Unterminated quotes run to the end of the line and blank input yields
 * {@link ParsedCommand#empty}.
 */
public final class CommandParser {

  private final CommandGrammar grammar;

  public CommandParser() {
    this(CommandGrammar.standard());
  }

  public CommandParser(CommandGrammar grammar) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
  }

  /** Parses with the standard grammar. */
  public static ParsedCommand parse(String line) {
    return new CommandParser().parseLine(line);
  }

  public ParsedCommand parseLine(String line) {
    if (line == null) {
      return ParsedCommand.empty("");
    }
    List<Token> tokens = tokenize(line);
    if (tokens.isEmpty()) {
      return ParsedCommand.empty(line);
    }

    String base = tokens.get(0).text;
    int pos = 1;
    Optional<String> subcommand = Optional.empty();
    if (tokens.size() > 1) {
      Token second = tokens.get(1);
      if (!second.isFlag() && grammar.isSubcommand(base, second.text)) {
        subcommand = Optional.of(second.text);
        pos = 2;
      }
    }

    Map<String, FlagValue> flags = new LinkedHashMap<>();
    List<String> positional = new ArrayList<>();
    while (pos < tokens.size()) {
      Token token = tokens.get(pos++);
      if (!token.isFlag()) {
        positional.add(token.text);
        continue;
      }
      String body = stripDashes(token.text);
      int eq = body.indexOf('=');
      if (eq > 0) {
        flags.put(body.substring(0, eq), FlagValue.of(body.substring(eq + 1)));
      } else if (pos < tokens.size() && !tokens.get(pos).isFlag()) {
        flags.put(body, FlagValue.of(tokens.get(pos++).text));
      } else {
        flags.put(body, FlagValue.present());
      }
    }
    return new ParsedCommand(base, subcommand, flags, positional, line);
  }

  private static String stripDashes(String token) {
    return token.startsWith("--") ? token.substring(2) : token.substring(1);
  }

  /** Splits a line into tokens, honouring quotes. Package-private for completion. */
  static List<Token> tokenize(String line) {
    List<Token> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    boolean startsQuoted = false;
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (c == '"' || c == '\'') {
        if (!inToken) {
          startsQuoted = true;
          inToken = true;
        }
        quote = c;
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          tokens.add(new Token(current.toString(), startsQuoted));
          current.setLength(0);
          inToken = false;
          startsQuoted = false;
        }
      } else {
        inToken = true;
        current.append(c);
      }
    }
    if (inToken) {
      tokens.add(new Token(current.toString(), startsQuoted));
    }
    return tokens;
  }

  static final class Token {
    final String text;
    final boolean quoted;

    Token(String text, boolean quoted) {
      this.text = text;
      this.quoted = quoted;
    }

    boolean isFlag() {
      return !quoted && text.length() > 1 && text.charAt(0) == '-' && !"--".equals(text);
    }
  }
}
