package com.motherrealm.backend.command.service;

import com.motherrealm.backend.command.config.RealmProperties;
import com.motherrealm.backend.common.exception.InvalidCommandException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/** Parses prompts of the form {@code PREFIX action(arg1,arg2,...)}. */
@Component
public class RealmCommandParser {

  private static final Pattern INVOCATION =
      Pattern.compile("^\\s*([A-Za-z][A-Za-z0-9_]*)\\s*\\((.*)\\)\\s*$", Pattern.DOTALL);

  private final RealmProperties properties;

  public RealmCommandParser(RealmProperties properties) {
    this.properties = properties;
  }

  public boolean isCommand(String prompt) {
    return prompt != null && prompt.startsWith(properties.getCommandPrefix());
  }

  public RealmCommand parse(String prompt) {
    if (!isCommand(prompt)) {
      throw new InvalidCommandException(
          "Realm commands must start with " + properties.getCommandPrefix());
    }
    String body = prompt.substring(properties.getCommandPrefix().length());
    Matcher matcher = INVOCATION.matcher(body);
    if (!matcher.matches()) {
      throw new InvalidCommandException("Malformed realm command: " + body.strip());
    }
    return new RealmCommand(matcher.group(1), splitArguments(matcher.group(2)));
  }

  private static List<String> splitArguments(String raw) {
    List<String> arguments = new ArrayList<>();
    if (!StringUtils.hasText(raw)) {
      return arguments;
    }
    for (String token : raw.split(",")) {
      String argument = token.strip();
      if (argument.contains("(") || argument.contains(")")) {
        throw new InvalidCommandException("Nested parentheses are not allowed in realm commands");
      }
      if (!argument.isEmpty()) {
        arguments.add(argument);
      }
    }
    return arguments;
  }
}
