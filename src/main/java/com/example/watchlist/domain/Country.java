package com.example.watchlist.domain;

import java.util.Locale;
import java.util.Optional;

public enum Country {
  DE,
  AR,
  AU,
  AT,
  AZ,
  BE,
  BR,
  BG,
  CA,
  CL,
  CO,
  HR,
  CY,
  CZ,
  DK,
  EC,
  EE,
  FI,
  FR,
  GR,
  HK,
  HU,
  IS,
  IN,
  ID,
  IE,
  IL,
  IT,
  JP,
  LT,
  MY,
  MX,
  MD,
  NL,
  NZ,
  MK,
  NO,
  PA,
  PE,
  PH,
  PL,
  PT,
  RO,
  RU,
  RS,
  SG,
  SK,
  SI,
  ZA,
  KR,
  ES,
  SE,
  CH,
  TH,
  TR,
  UA,
  AE,
  GB,
  US,
  VN;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Country> fromCode(String code) {
    if (code == null || code.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Country.valueOf(code.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException ignored) {
      return Optional.empty();
    }
  }
}
