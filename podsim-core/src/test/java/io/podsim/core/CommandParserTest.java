package io.podsim.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CommandParserTest {

  @Test
  void quotedFlagValueKeepsInnerSpace() {
    ParsedCommand cmd = CommandParser.parse("sinfo -o \"%n %G\"");

    assertEquals("sinfo", cmd.baseCommand());
    assertEquals(Optional.of("%n %G"), cmd.flagValue("o"));
    assertTrue(cmd.positionalArgs().isEmpty());
  }

  @Test
  void singleQuotesWorkLikeDoubleQuotes() {
    ParsedCommand cmd = CommandParser.parse("echo 'hello world' again");

    assertEquals(List.of("hello world", "again"), cmd.positionalArgs());
  }

  @Test
  void combinedShortFlagIsOneFlag() {
    ParsedCommand cmd = CommandParser.parse("ls -la");

    assertTrue(cmd.hasFlag("la"));
    assertTrue(cmd.flags().get("la").isBoolean());
  }

  @Test
  void equalsFormSplitsAtFirstEquals() {
    ParsedCommand cmd = CommandParser.parse("tool --option=key=value");

    assertEquals(Optional.of("key=value"), cmd.flagValue("option"));
  }

  @Test
  void queryFlagsWithEqualsAndSpaceValues() {
    ParsedCommand cmd =
        CommandParser.parse("nvidia-smi --query-gpu=temperature.gpu --format=csv,noheader -i 0");

    assertEquals(Optional.of("temperature.gpu"), cmd.flagValue("query-gpu"));
    assertEquals(Optional.of("csv,noheader"), cmd.flagValue("format"));
    assertEquals(Optional.of("0"), cmd.flagValue("i"));
  }

  @Test
  void flagFollowedByFlagIsBoolean() {
    ParsedCommand cmd = CommandParser.parse("nvidia-smi -q -d ECC");

    assertTrue(cmd.flags().get("q").isBoolean());
    assertEquals(Optional.of("ECC"), cmd.flagValue("d"));
  }

  @Test
  void knownSubcommandIsRecognised() {
    ParsedCommand cmd = CommandParser.parse("dcgmi diag -r 1 -g 0");

    assertEquals(Optional.of("diag"), cmd.subcommand());
    assertEquals(Optional.of("1"), cmd.flagValue("r"));
    assertEquals(Optional.of("0"), cmd.flagValue("g"));
  }

  @Test
  void unknownSecondTokenStaysPositional() {
    ParsedCommand cmd = CommandParser.parse("dcgmi bogus");

    assertTrue(cmd.subcommand().isEmpty());
    assertEquals(List.of("bogus"), cmd.positionalArgs());
  }

  @Test
  void flagAsSecondTokenIsNotASubcommand() {
    ParsedCommand cmd = CommandParser.parse("cmsh --help");

    assertTrue(cmd.subcommand().isEmpty());
    assertTrue(cmd.hasFlag("help"));
  }

  @Test
  void positionalOrderIsPreserved() {
    ParsedCommand cmd = CommandParser.parse("scontrol update nodename=dgx-00 state=drain reason=x");

    assertEquals(Optional.of("update"), cmd.subcommand());
    assertEquals(
        List.of("nodename=dgx-00", "state=drain", "reason=x"), cmd.positionalArgs());
  }

  @Test
  void flagCapturesFollowingPositional() {
    ParsedCommand cmd = CommandParser.parse("sbatch --gres=gpu:4 train.sh");

    assertEquals(Optional.of("gpu:4"), cmd.flagValue("gres"));
    assertEquals(List.of("train.sh"), cmd.positionalArgs());
  }

  @Test
  void quotedDashTokenIsPositional() {
    ParsedCommand cmd = CommandParser.parse("echo \"-n\" -- -");

    assertTrue(cmd.flags().isEmpty());
    assertEquals(List.of("-n", "--", "-"), cmd.positionalArgs());
  }

  @Test
  void caseIsPreserved() {
    ParsedCommand cmd = CommandParser.parse("Nvidia-SMI -L");

    assertEquals("Nvidia-SMI", cmd.baseCommand());
    assertTrue(cmd.hasFlag("L"));
    assertFalse(cmd.hasFlag("l"));
  }

  @Test
  void unterminatedQuoteRunsToEndOfLine() {
    ParsedCommand cmd = CommandParser.parse("echo \"abc def");

    assertEquals(List.of("abc def"), cmd.positionalArgs());
  }

  @Test
  void blankInputParsesToEmptyCommand() {
    for (String line : new String[] {"", "   ", "\t"}) {
      ParsedCommand cmd = CommandParser.parse(line);
      assertTrue(cmd.isEmpty(), line);
      assertEquals("", cmd.baseCommand());
      assertTrue(cmd.flags().isEmpty());
      assertTrue(cmd.positionalArgs().isEmpty());
    }
    assertTrue(CommandParser.parse(null).isEmpty());
  }

  @Test
  void rawLineIsKept() {
    String line = "nvidia-bug-report.sh -o /tmp/x.log.gz";
    ParsedCommand cmd = CommandParser.parse(line);

    assertEquals(line, cmd.raw());
    assertEquals(Optional.of("/tmp/x.log.gz"), cmd.flagValue("o", "output-file"));
  }

  @Test
  void flagsKeepTheirOrder() {
    ParsedCommand cmd = CommandParser.parse("tool -c 1 -a -b 2");

    assertEquals(List.of("c", "a", "b"), List.copyOf(cmd.flags().keySet()));
  }

  @Test
  void customGrammarDrivesSubcommands() {
    CommandParser parser =
        new CommandParser(CommandGrammar.standard().withCommand("mytool", List.of("run")));

    assertEquals(Optional.of("run"), parser.parseLine("mytool run fast").subcommand());
    assertTrue(CommandParser.parse("mytool run fast").subcommand().isEmpty());
  }

  @Test
  void toCommandLineReparsesToSameParts() {
    ParsedCommand cmd = CommandParser.parse("sinfo -o \"%n %G\" -N extra");
    ParsedCommand again = CommandParser.parse(cmd.toCommandLine());

    assertEquals(cmd.baseCommand(), again.baseCommand());
    assertEquals(cmd.flags(), again.flags());
    assertEquals(cmd.positionalArgs(), again.positionalArgs());
  }
}
