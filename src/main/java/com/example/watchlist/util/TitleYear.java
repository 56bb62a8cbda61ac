package com.example.watchlist.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record TitleYear(String title, String year) {
  private static final Pattern TRAILING_YEAR_PATTERN = Pattern.compile("\\s*\\((\\d{4})\\)\\s*$");

  public static TitleYear parse(String displayName) {
    String value = displayName == null ? "" : displayName;
    Matcher matcher = TRAILING_YEAR_PATTERN.matcher(value);
    if (matcher.find()) {
      return new TitleYear(value.substring(0, matcher.start()).trim(), matcher.group(1));
    }
    return new TitleYear(value.trim(), null);
  }

  public boolean hasYear() {
    return year != null;
  }

  public boolean matchesYear(Integer releaseYear) {
    return year != null && releaseYear != null && year.equals(String.valueOf(releaseYear));
  }
}
