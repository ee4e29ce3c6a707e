package dev.workflowcron.scheduler.cli;

import dev.workflowcron.scheduler.cron.CronMath;
import dev.workflowcron.scheduler.cron.TimezoneCatalog;
import dev.workflowcron.scheduler.exceptions.CronConversionException;
import dev.workflowcron.scheduler.exceptions.InvalidCronException;
import dev.workflowcron.scheduler.exceptions.UnknownTimezoneException;
import dev.workflowcron.scheduler.json.JSONUtil;

import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "cron",
    description = "Check cron expressions and timezones",
    subcommands = {
      ValidateCronCommand.class,
      ConvertCronCommand.class,
      TimezonesCommand.class,
    })
public class CronCommand implements Runnable {

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }
}

@Command(name = "validate", description = "Validate and describe a five field cron expression")
class ValidateCronCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Cron expression, quoted")
  String expression;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    try {
      var validation = new CronMath().validate(expression);
      spec.commandLine().getOut().println(JSONUtil.prettyPrint(validation));
      return 0;
    } catch (InvalidCronException e) {
      spec.commandLine().getErr().println(e.getMessage());
      return 1;
    }
  }
}

@Command(name = "convert", description = "Show when an expression fires in UTC")
class ConvertCronCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "Cron expression, quoted")
  String expression;

  @Option(
      names = {"-z", "--timezone"},
      description = "IANA timezone the expression is read in",
      required = true)
  String timezone;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    try {
      var conversion = new CronMath().convertToUTC(expression, timezone);
      spec.commandLine().getOut().println(JSONUtil.prettyPrint(conversion));
      return 0;
    } catch (InvalidCronException | CronConversionException e) {
      spec.commandLine().getErr().println(e.getMessage());
      return 1;
    }
  }
}

@Command(name = "timezones", description = "List the offered timezones, or check one")
class TimezonesCommand implements Callable<Integer> {

  @Option(
      names = {"-c", "--check"},
      description = "Describe this timezone instead of listing all")
  String timezone;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() {
    var catalog = new TimezoneCatalog();
    var out = spec.commandLine().getOut();
    if (timezone == null) {
      out.println(JSONUtil.prettyPrint(catalog.listTimezones()));
      return 0;
    }
    try {
      out.println(JSONUtil.prettyPrint(catalog.validateTimezone(timezone)));
      return 0;
    } catch (UnknownTimezoneException e) {
      spec.commandLine().getErr().println(e.getMessage());
      return 1;
    }
  }
}
