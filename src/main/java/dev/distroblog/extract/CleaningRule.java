package dev.distroblog.extract;

import java.util.regex.Pattern;

/**
 * One named regex substitution of the content cleaner.
 *
 * @param replacement a {@link java.util.regex.Matcher#replaceAll(String)} replacement string
 */
public record CleaningRule(String name, Pattern pattern, String replacement) {

  static CleaningRule remove(String name, String regex) {
    return new CleaningRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), "");
  }

  static CleaningRule replace(String name, String regex, String replacement) {
    return new CleaningRule(name, Pattern.compile(regex), replacement);
  }

  public String apply(String text) {
    return pattern.matcher(text).replaceAll(replacement);
  }
}
