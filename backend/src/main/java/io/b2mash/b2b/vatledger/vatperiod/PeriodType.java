package io.b2mash.b2b.vatledger.vatperiod;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.b2b.vatledger.exception.InvalidPeriodKeyException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;

/** Fiscal period granularity. Serialized as {@code monthly} / {@code quarterly}. */
public enum PeriodType {
  MONTHLY(12, 1),
  QUARTERLY(4, 3);

  private final int periodsPerYear;
  private final int monthsPerPeriod;

  PeriodType(int periodsPerYear, int monthsPerPeriod) {
    this.periodsPerYear = periodsPerYear;
    this.monthsPerPeriod = monthsPerPeriod;
  }

  public int periodsPerYear() {
    return periodsPerYear;
  }

  public int monthsPerPeriod() {
    return monthsPerPeriod;
  }

  public boolean isValidPeriod(int period) {
    return period >= 1 && period <= periodsPerYear;
  }

  /** First day of the period. */
  public LocalDate startDate(int year, int period) {
    return LocalDate.of(year, (period - 1) * monthsPerPeriod + 1, 1);
  }

  /** Last day of the period, inclusive. */
  public LocalDate endDate(int year, int period) {
    return YearMonth.of(year, period * monthsPerPeriod).atEndOfMonth();
  }

  /** Human label: {@code 03/2024} for months, {@code Q1 2024} for quarters. */
  public String display(int year, int period) {
    return switch (this) {
      case MONTHLY -> String.format("%02d/%d", period, year);
      case QUARTERLY -> "Q" + period + " " + year;
    };
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static PeriodType from(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidPeriodKeyException("Period type is required");
    }
    try {
      return PeriodType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidPeriodKeyException(
          "Unknown period type '" + value + "'; expected monthly or quarterly");
    }
  }
}
