package io.intellixity.quire.persistence.query;

import java.util.regex.Pattern;

public final class LikePatterns {
  private LikePatterns() {}

  /** Translates SQL LIKE to an anchored regex. '%' -> '.*', '_' -> '.' */
  public static String toRegex(String likePattern) {
    StringBuilder re = new StringBuilder();
    re.append("^");
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append(".");
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    re.append("$");
    return re.toString();
  }
}
